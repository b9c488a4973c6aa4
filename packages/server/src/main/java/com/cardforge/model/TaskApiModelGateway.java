package com.cardforge.model;

import com.cardforge.exception.CardForgeErrorCode;
import com.cardforge.exception.ConfigurationException;
import com.cardforge.exception.GatewayException;
import com.cardforge.logging.LoggingService;
import com.cardforge.utility.JacksonUtility;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/**
 * {@link ModelGateway} backed by a task-based LLM executor service.
 *
 * <p>A generation is submitted with {@code POST /api/v1/tasks} and then polled with {@code GET
 * /api/v1/tasks/{id}} until the task is {@code completed} or {@code failed}. Polling stops once
 * {@code gateway.timeout-seconds} has elapsed. Recognized configuration keys, besides those of
 * {@link AbstractModelGateway}:
 *
 * <ul>
 *   <li>{@code gateway.base-url} (required)
 *   <li>{@code gateway.api-key} (optional, sent as a bearer token)
 *   <li>{@code gateway.poll-interval-ms} (default 500)
 * </ul>
 */
public class TaskApiModelGateway extends AbstractModelGateway {
  private static final Logger log = LoggingService.getLogger(TaskApiModelGateway.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final double TASK_PRIORITY = 5.0;

  private final OkHttpClient httpClient;
  private final HttpUrl baseUrl;
  private final String apiKey;
  private final long pollIntervalMs;
  private final long pollDeadlineMs;

  public TaskApiModelGateway(Configuration configuration, OkHttpClient httpClient) {
    super(configuration);
    String url = configuration.getString("gateway.base-url", null);
    if (StringUtils.isBlank(url)) {
      throw new ConfigurationException("gateway.base-url is not configured");
    }
    HttpUrl parsed = HttpUrl.parse(StringUtils.removeEnd(url.trim(), "/"));
    if (parsed == null) {
      throw new ConfigurationException("Invalid gateway.base-url: " + url);
    }
    this.baseUrl = parsed;
    this.httpClient = httpClient;
    this.apiKey = configuration.getString("gateway.api-key", null);
    this.pollIntervalMs = configuration.getLong("gateway.poll-interval-ms", 500L);
    this.pollDeadlineMs =
        TimeUnit.SECONDS.toMillis(configuration.getLong("gateway.timeout-seconds", 120L));
  }

  @Override
  protected String providerName() {
    return "task-api";
  }

  @Override
  protected CompletionResponse runGeneration(CompletionRequest request) throws Exception {
    String taskId = createTask(request);
    log.debug("Created task {} for model {}", taskId, request.model());
    JsonNode task = pollTask(taskId);

    JsonNode result = task.path("result");
    JsonNode usage = result.path("usage");
    return new CompletionResponse(
        result.path("text").asText(""),
        result.path("model").asText(request.model()),
        usage.path("prompt_tokens").asLong(0),
        usage.path("completion_tokens").asLong(0),
        result.path("finish_reason").asText("stop"));
  }

  private String createTask(CompletionRequest request) throws IOException {
    ObjectMapper mapper = JacksonUtility.getJsonMapper();
    ObjectNode payload = mapper.createObjectNode();
    payload.put("model", request.model());
    payload.put(
        "prompt", "System: " + request.systemPrompt() + "\n\nUser: " + request.userPrompt());
    payload.put("temperature", request.temperature());
    payload.put("max_tokens", request.maxTokens());
    payload.put("priority", TASK_PRIORITY);
    if (request.responseSchema() != null) {
      ObjectNode format = payload.putObject("response_format");
      format.put("type", "json_schema");
      ObjectNode jsonSchema = format.putObject("json_schema");
      jsonSchema.put("name", "response");
      jsonSchema.set("schema", request.responseSchema());
    }

    Request httpRequest =
        newRequest(baseUrl.newBuilder().addPathSegments("api/v1/tasks").build())
            .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
            .build();

    try (Response response = httpClient.newCall(httpRequest).execute()) {
      String body = bodyOf(response);
      if (response.code() == 429) {
        String retryAfter = StringUtils.defaultIfBlank(response.header("Retry-After"), "60");
        throw (GatewayException)
            new GatewayException(
                    CardForgeErrorCode.GATEWAY_RATE_LIMITED,
                    "Model service rate limit exceeded. Retry after " + retryAfter + "s",
                    null)
                .with("retryAfter", retryAfter);
      }
      if (!response.isSuccessful()) {
        log.error("Task creation failed with status {}: {}", response.code(), body);
        throw (GatewayException)
            new GatewayException("Model service error: " + response.code() + " - " + body)
                .with("status", response.code());
      }
      JsonNode data = mapper.readTree(body);
      String taskId = data == null ? null : data.path("task_id").asText(null);
      if (StringUtils.isBlank(taskId)) {
        throw new GatewayException("Model service did not return a task id");
      }
      return taskId;
    }
  }

  private JsonNode pollTask(String taskId) throws IOException, InterruptedException {
    HttpUrl url =
        baseUrl.newBuilder().addPathSegments("api/v1/tasks").addPathSegment(taskId).build();
    long deadline = System.currentTimeMillis() + pollDeadlineMs;
    while (true) {
      try (Response response = httpClient.newCall(newRequest(url).get().build()).execute()) {
        String body = bodyOf(response);
        if (!response.isSuccessful()) {
          throw new GatewayException("Failed to get task status: " + body);
        }
        JsonNode data = JacksonUtility.getJsonMapper().readTree(body);
        String status = data == null ? "" : data.path("status").asText("");
        switch (status) {
          case "completed":
            return data;
          case "failed":
            throw new GatewayException(
                "Model service task failed: " + data.path("error").asText("Unknown error"));
          default:
            log.trace("Task {} is {}", taskId, status);
        }
      }
      if (System.currentTimeMillis() >= deadline) {
        throw new GatewayException(
            CardForgeErrorCode.GATEWAY_TIMEOUT,
            "Task " + taskId + " timed out after " + pollDeadlineMs / 1000 + "s",
            null);
      }
      Thread.sleep(pollIntervalMs);
    }
  }

  private Request.Builder newRequest(HttpUrl url) {
    Request.Builder builder = new Request.Builder().url(url);
    if (StringUtils.isNotBlank(apiKey)) {
      builder.header("Authorization", "Bearer " + apiKey);
    }
    return builder;
  }

  private static String bodyOf(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }
}
