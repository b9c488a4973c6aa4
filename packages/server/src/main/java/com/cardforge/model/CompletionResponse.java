package com.cardforge.model;

/** Result of a generation call, with token accounting as reported by the provider. */
public record CompletionResponse(
    String content, String model, long inputTokens, long outputTokens, String finishReason) {

  public CompletionResponse {
    content = content == null ? "" : content;
  }
}
