package com.cardforge;

import com.cardforge.exception.CardForgeException;
import com.cardforge.exception.ValidationException;
import com.cardforge.generation.CardType;
import com.cardforge.generation.Difficulty;
import com.cardforge.generation.GenerationRequest;
import com.cardforge.jobs.GenerationEvent;
import com.cardforge.jobs.GenerationEventStream;
import com.cardforge.jobs.GenerationEventType;
import com.cardforge.logging.LoggingService;
import com.cardforge.utility.JacksonUtility;
import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.PrintStream;

/**
 * Command line entry point. Streams one generation request and prints every event to stdout as a
 * JSON line; logs go to stderr.
 *
 * <pre>
 * --topic=... [--count=5] [--deck=cli] [--context=...] [--type=basic|cloze|basic_reversed]
 * [--difficulty=easy|medium|hard] [--language=en] [--model=...] [--tags=a,b] [--no-fact-check]
 * [--no-sources] [--config=path/to/application.yaml]
 * </pre>
 */
public class CardForgeApp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(CardForgeApp.class);

  public static void main(String[] args) {
    int exitCode;
    try (CardForge app = new CardForge(args)) {
      app.initialize();
      exitCode = run(app, System.out);
    } catch (CardForgeException e) {
      log.error("Application failed: {}", e.getMessage(), e);
      exitCode = 1;
    } catch (Exception e) {
      log.error("Application failed to start", e);
      exitCode = 1;
    }
    System.exit(exitCode);
  }

  /** Stream the request described by the startup parameters. Returns the process exit code. */
  static int run(CardForge app, PrintStream out) throws JsonProcessingException {
    GenerationRequest request = toRequest(app.startupParameters());
    boolean failed = false;
    try (GenerationEventStream events = app.jobManager().streamJob(request)) {
      while (events.hasNext()) {
        GenerationEvent event = events.next();
        out.println(JacksonUtility.getJsonMapper().writeValueAsString(event));
        failed = event.type() == GenerationEventType.ERROR;
      }
    }
    out.flush();
    return failed ? 2 : 0;
  }

  static GenerationRequest toRequest(StartupParameters params) {
    String topic = params.getParameter("topic", String.class);
    if (topic == null) {
      throw new ValidationException("--topic is required");
    }
    GenerationRequest.Builder builder =
        GenerationRequest.builder(topic, params.getParameter("deck", "cli"))
            .factCheck(!params.has("no-fact-check"))
            .includeSources(!params.has("no-sources"))
            .tags(params.getList("tags"));
    Integer count = params.getParameter("count", Integer.class);
    if (count != null) {
      builder.requestedCount(count);
    }
    if (params.has("type")) {
      builder.cardType(CardType.fromValue(params.getParameter("type", String.class)));
    }
    if (params.has("difficulty")) {
      builder.difficulty(Difficulty.fromValue(params.getParameter("difficulty", String.class)));
    }
    if (params.has("language")) {
      builder.language(params.getParameter("language", String.class));
    }
    builder.context(params.getParameter("context", String.class));
    builder.modelId(params.getParameter("model", String.class));
    return builder.build().validate();
  }
}
