package com.cardforge.model;

import static org.junit.jupiter.api.Assertions.*;

import com.cardforge.exception.CardForgeErrorCode;
import com.cardforge.exception.ConfigurationException;
import com.cardforge.exception.GatewayException;
import com.cardforge.http.OkHttpFactory;
import com.cardforge.utility.JacksonUtility;
import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TaskApiModelGatewayTest {
  private static final MediaType JSON = MediaType.get("application/json");

  /** Answers calls from a script instead of the network and records every request. */
  static class ScriptedServer implements Interceptor {
    private final Deque<Object[]> responses = new ArrayDeque<>();
    final List<Request> requests = new ArrayList<>();
    final List<String> bodies = new ArrayList<>();

    ScriptedServer respond(int code, String body) {
      return respond(code, body, null);
    }

    ScriptedServer respond(int code, String body, String retryAfter) {
      responses.add(new Object[] {code, body, retryAfter});
      return this;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
      Request request = chain.request();
      requests.add(request);
      if (request.body() != null) {
        Buffer buffer = new Buffer();
        request.body().writeTo(buffer);
        bodies.add(buffer.readUtf8());
      }
      Object[] next = responses.size() > 1 ? responses.poll() : responses.peek();
      Response.Builder builder =
          new Response.Builder()
              .request(request)
              .protocol(Protocol.HTTP_1_1)
              .code((Integer) next[0])
              .message("scripted")
              .body(ResponseBody.create((String) next[1], JSON));
      if (next[2] != null) {
        builder.header("Retry-After", (String) next[2]);
      }
      return builder.build();
    }
  }

  private TaskApiModelGateway gateway;

  private TaskApiModelGateway gateway(ScriptedServer server) {
    Configuration config = new BaseConfiguration();
    config.setProperty("gateway.base-url", "http://llm.test/");
    config.setProperty("gateway.api-key", "secret");
    config.setProperty("gateway.poll-interval-ms", 1);
    config.setProperty("gateway.timeout-seconds", 5);
    config.setProperty("gateway.default-model", "test-model");
    gateway = new TaskApiModelGateway(config, OkHttpFactory.create(Duration.ofSeconds(5), server));
    return gateway;
  }

  @AfterEach
  void tearDown() {
    if (gateway != null) {
      gateway.close();
    }
  }

  @Test
  @DisplayName("A task is created, polled until completed and mapped to a response")
  void createAndPoll() throws Exception {
    ScriptedServer server =
        new ScriptedServer()
            .respond(200, "{\"task_id\": \"t-1\"}")
            .respond(200, "{\"status\": \"running\"}")
            .respond(
                200,
                """
                {"status": "completed",
                 "result": {"text": "[]", "model": "test-model-v2",
                            "usage": {"prompt_tokens": 12, "completion_tokens": 3}}}""");

    CompletionResponse response =
        gateway(server)
            .generate(
                CompletionRequest.of(null, "be brief", "make cards", 0.7, 400)
                    .withResponseSchema(JacksonUtility.getJsonMapper().createObjectNode()));

    assertEquals("[]", response.content());
    assertEquals("test-model-v2", response.model());
    assertEquals(12, response.inputTokens());
    assertEquals(3, response.outputTokens());
    assertEquals("stop", response.finishReason());

    assertEquals(3, server.requests.size());
    Request create = server.requests.get(0);
    assertEquals("POST", create.method());
    assertEquals("http://llm.test/api/v1/tasks", create.url().toString());
    assertEquals("Bearer secret", create.header("Authorization"));
    assertEquals("http://llm.test/api/v1/tasks/t-1", server.requests.get(2).url().toString());

    JsonNode payload = JacksonUtility.getJsonMapper().readTree(server.bodies.get(0));
    assertEquals("test-model", payload.get("model").asText());
    assertEquals("System: be brief\n\nUser: make cards", payload.get("prompt").asText());
    assertEquals(400, payload.get("max_tokens").asInt());
    assertEquals("json_schema", payload.path("response_format").path("type").asText());
  }

  @Test
  @DisplayName("HTTP 429 is reported as a rate limit with the retry delay")
  void rateLimited() {
    ScriptedServer server = new ScriptedServer().respond(429, "slow down", "30");

    GatewayException e =
        assertThrows(
            GatewayException.class,
            () -> gateway(server).generate(CompletionRequest.of(null, "s", "u", 0.5, 10)));

    assertEquals(CardForgeErrorCode.GATEWAY_RATE_LIMITED, e.getCode());
    assertEquals("30", e.getContext().get("retryAfter"));
  }

  @Test
  @DisplayName("Server errors and failed tasks become gateway exceptions")
  void failures() {
    ScriptedServer serverError = new ScriptedServer().respond(503, "unavailable");
    GatewayException e =
        assertThrows(
            GatewayException.class,
            () -> gateway(serverError).generate(CompletionRequest.of(null, "s", "u", 0.5, 10)));
    assertEquals(503, e.getContext().get("status"));
    gateway.close();

    ScriptedServer failedTask =
        new ScriptedServer()
            .respond(200, "{\"task_id\": \"t-2\"}")
            .respond(200, "{\"status\": \"failed\", \"error\": \"model crashed\"}");
    GatewayException failed =
        assertThrows(
            GatewayException.class,
            () -> gateway(failedTask).generate(CompletionRequest.of(null, "s", "u", 0.5, 10)));
    assertTrue(failed.getMessage().contains("model crashed"));
  }

  @Test
  @DisplayName("Claim verification parses the JSON answer and clamps the confidence")
  void verifyClaim() {
    ScriptedServer server =
        new ScriptedServer()
            .respond(200, "{\"task_id\": \"t-3\"}")
            .respond(
                200,
                "{\"status\": \"completed\", \"result\": {\"text\":"
                    + " \"{\\\"confidence\\\": 1.4, \\\"sources\\\": [\\\"NASA\\\", \\\"\\\"],"
                    + " \\\"reasoning\\\": \\\"known\\\"}\"}}");

    ClaimVerification verification = gateway(server).verifyClaim("The sun is a star", null);

    assertEquals(1.0, verification.confidence());
    assertEquals(List.of("NASA"), verification.sources());
    assertEquals("known", verification.reasoning());
  }

  @Test
  @DisplayName("An unparseable verification answer counts as 0.5 with the raw text as reasoning")
  void verifyClaimUnparseable() {
    ScriptedServer server =
        new ScriptedServer()
            .respond(200, "{\"task_id\": \"t-4\"}")
            .respond(200, "{\"status\": \"completed\", \"result\": {\"text\": \"probably true\"}}");

    ClaimVerification verification = gateway(server).verifyClaim("claim", "context");

    assertEquals(0.5, verification.confidence());
    assertTrue(verification.sources().isEmpty());
    assertEquals("probably true", verification.reasoning());
  }

  @Test
  @DisplayName("A missing base URL is a configuration error")
  void missingBaseUrl() {
    assertThrows(
        ConfigurationException.class,
        () ->
            new TaskApiModelGateway(
                new BaseConfiguration(), OkHttpFactory.create(Duration.ofSeconds(1))));
  }
}
