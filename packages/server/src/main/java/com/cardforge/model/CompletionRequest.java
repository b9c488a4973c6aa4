package com.cardforge.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parameters of a single generation call.
 *
 * @param model model identifier, or {@code null} for the gateway default
 * @param responseSchema optional JSON schema constraining the output
 */
public record CompletionRequest(
    String model,
    String systemPrompt,
    String userPrompt,
    double temperature,
    int maxTokens,
    JsonNode responseSchema) {

  public static CompletionRequest of(
      String model, String systemPrompt, String userPrompt, double temperature, int maxTokens) {
    return new CompletionRequest(model, systemPrompt, userPrompt, temperature, maxTokens, null);
  }

  public CompletionRequest withResponseSchema(JsonNode schema) {
    return new CompletionRequest(model, systemPrompt, userPrompt, temperature, maxTokens, schema);
  }

  public CompletionRequest withModel(String resolvedModel) {
    return new CompletionRequest(
        resolvedModel, systemPrompt, userPrompt, temperature, maxTokens, responseSchema);
  }
}
