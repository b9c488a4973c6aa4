package com.cardforge.model;

import com.cardforge.exception.CardForgeErrorCode;
import com.cardforge.exception.ExceptionUtil;
import com.cardforge.exception.GatewayException;
import com.cardforge.logging.LoggingService;
import com.cardforge.utility.JacksonUtility;
import com.cardforge.utility.ModelOutputParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * Base {@link ModelGateway} with the plumbing shared by all providers.
 *
 * <p>Subclasses implement {@link #runGeneration(CompletionRequest)} against a concrete transport.
 * This class wraps that call with model resolution, timing and a hard inference timeout, and
 * implements {@link #verifyClaim(String, String)} on top of structured generation. Recognized
 * configuration keys:
 *
 * <ul>
 *   <li>{@code gateway.default-model} (string)
 *   <li>{@code gateway.fact-check-model} (string, defaults to the default model)
 *   <li>{@code gateway.timeout-seconds} (int, default 120)
 * </ul>
 */
public abstract class AbstractModelGateway implements ModelGateway, AutoCloseable {
  private static final Logger log = LoggingService.getLogger(AbstractModelGateway.class);

  static final String FACT_CHECK_SYSTEM_PROMPT =
      """
      You are a fact-checking assistant. \
      Your task is to verify claims using your knowledge and provide a confidence score.

      You must respond in the following JSON format:
      {
          "confidence": <float between 0.0 and 1.0>,
          "sources": [<list of source descriptions or URLs if known>],
          "reasoning": "<your reasoning for the confidence score>"
      }

      Confidence levels:
      - 0.9-1.0: Highly confident, well-established fact
      - 0.7-0.9: Confident, generally accepted
      - 0.5-0.7: Moderate confidence, some uncertainty
      - 0.3-0.5: Low confidence, conflicting information
      - 0.0-0.3: Very low confidence, likely false or unverifiable""";

  private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

  protected final Configuration configuration;
  private final String defaultModel;
  private final String factCheckModel;
  private final long inferenceTimeoutMs;
  private final ExecutorService inferenceExecutor =
      Executors.newCachedThreadPool(
          r -> {
            Thread t = new Thread(r, "model-gateway-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
          });

  protected AbstractModelGateway(Configuration configuration) {
    this.configuration = configuration;
    this.defaultModel = configuration.getString("gateway.default-model", "gpt-4o-mini");
    this.factCheckModel = configuration.getString("gateway.fact-check-model", defaultModel);
    this.inferenceTimeoutMs =
        TimeUnit.SECONDS.toMillis(configuration.getLong("gateway.timeout-seconds", 120L));
  }

  /** Execute a single generation against the concrete provider. */
  protected abstract CompletionResponse runGeneration(CompletionRequest request) throws Exception;

  /** Provider name used in log lines. */
  protected abstract String providerName();

  @Override
  public String defaultModel() {
    return defaultModel;
  }

  @Override
  public CompletionResponse generate(CompletionRequest request) {
    CompletionRequest resolved =
        request.model() == null || request.model().isBlank()
            ? request.withModel(defaultModel)
            : request;
    log.trace(
        "generate() called with: model = [{}], temperature = [{}], maxTokens = [{}], schema = [{}]",
        resolved.model(),
        resolved.temperature(),
        resolved.maxTokens(),
        resolved.responseSchema() != null);

    long start = System.currentTimeMillis();
    Future<CompletionResponse> future = inferenceExecutor.submit(() -> runGeneration(resolved));
    try {
      CompletionResponse response = future.get(inferenceTimeoutMs, TimeUnit.MILLISECONDS);
      log.info(
          "[Inference] - {}: model {} took {} ms, tokens in/out {}/{}, finish reason {}",
          providerName(),
          response.model(),
          System.currentTimeMillis() - start,
          response.inputTokens(),
          response.outputTokens(),
          response.finishReason());
      return response;
    } catch (TimeoutException e) {
      future.cancel(true);
      String errorMsg =
          String.format(
              "Model inference timed out after %d seconds", inferenceTimeoutMs / 1000);
      log.error(errorMsg);
      throw new GatewayException(CardForgeErrorCode.GATEWAY_TIMEOUT, errorMsg, e);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new GatewayException("Model inference was interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.warn(
          "[Inference] - {}: call failed after {} ms: {}",
          providerName(),
          System.currentTimeMillis() - start,
          cause.getMessage());
      throw ExceptionUtil.rethrowIfUnchecked(
          cause,
          ex ->
              new GatewayException(
                  "There was a problem while running the inference with the chosen model: "
                      + ex.getMessage(),
                  ex));
    }
  }

  @Override
  public ClaimVerification verifyClaim(String claim, String context) {
    String userPrompt = "Please fact-check the following claim:\n\nClaim: " + claim;
    if (context != null && !context.isBlank()) {
      userPrompt += "\n\nContext: " + context;
    }

    CompletionResponse response =
        generate(
            CompletionRequest.of(factCheckModel, FACT_CHECK_SYSTEM_PROMPT, userPrompt, 0.1, 1000)
                .withResponseSchema(verificationSchema()));

    Optional<JsonNode> parsed = ModelOutputParser.parseObject(response.content());
    if (parsed.isEmpty()) {
      log.warn(
          "Failed to parse fact-check response as JSON: {}",
          StringUtils.abbreviate(response.content(), 500));
      return new ClaimVerification(0.5, List.of(), response.content());
    }
    JsonNode node = parsed.get();
    List<String> sources = new ArrayList<>();
    JsonNode sourcesNode = node.path("sources");
    if (sourcesNode.isArray()) {
      sourcesNode.forEach(
          s -> {
            if (!s.isNull() && !s.asText().isBlank()) sources.add(s.asText());
          });
    }
    return new ClaimVerification(
        node.path("confidence").asDouble(0.5),
        sources,
        node.path("reasoning").asText("No reasoning provided"));
  }

  static JsonNode verificationSchema() {
    ObjectNode schema = JacksonUtility.getJsonMapper().createObjectNode();
    schema.put("type", "object");
    ObjectNode properties = schema.putObject("properties");
    properties
        .putObject("confidence")
        .put("type", "number")
        .put("minimum", 0.0)
        .put("maximum", 1.0);
    properties.putObject("sources").put("type", "array").putObject("items").put("type", "string");
    properties.putObject("reasoning").put("type", "string");
    ArrayNode required = schema.putArray("required");
    required.add("confidence").add("sources").add("reasoning");
    return schema;
  }

  @Override
  public void close() {
    inferenceExecutor.shutdownNow();
  }
}
