package com.cardforge.model;

import com.cardforge.exception.GatewayException;
import com.cardforge.logging.LoggingService;
import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * OpenAI implementation of {@link ModelGateway} using the openai-java SDK (Chat Completions API).
 * Schema-constrained requests are sent in JSON-object mode; the schema itself travels in the
 * prompt and the output is validated by the callers' parsers.
 */
public class OpenAiModelGateway extends AbstractModelGateway {
  private static final Logger log = LoggingService.getLogger(OpenAiModelGateway.class);
  private final OpenAIClient openAIClient;

  public OpenAiModelGateway(Configuration configuration, OpenAIClient openAIClient) {
    super(configuration);
    this.openAIClient = openAIClient;
  }

  @Override
  protected String providerName() {
    return "openai";
  }

  @Override
  protected CompletionResponse runGeneration(CompletionRequest request) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder()
            .model(request.model())
            .addSystemMessage(request.systemPrompt())
            .addUserMessage(request.userPrompt())
            .temperature(request.temperature())
            .maxCompletionTokens((long) request.maxTokens());
    if (request.responseSchema() != null) {
      builder.responseFormat(ResponseFormatJsonObject.builder().build());
    }

    ChatCompletion chatCompletion = openAIClient.chat().completions().create(builder.build());
    if (chatCompletion.choices().isEmpty()) {
      throw new GatewayException("No choices returned from OpenAI inference.");
    }
    ChatCompletion.Choice choice = chatCompletion.choices().get(0);
    String content =
        choice
            .message()
            .content()
            .orElseThrow(
                () -> new GatewayException("No content returned from OpenAI inference."));

    long promptTokens = 0;
    long completionTokens = 0;
    if (chatCompletion.usage().isPresent()) {
      promptTokens = chatCompletion.usage().get().promptTokens();
      completionTokens = chatCompletion.usage().get().completionTokens();
    }
    log.debug("OpenAI completion {} finished: {}", chatCompletion.id(), choice.finishReason());
    return new CompletionResponse(
        content.trim(),
        chatCompletion.model(),
        promptTokens,
        completionTokens,
        choice.finishReason().toString());
  }
}
