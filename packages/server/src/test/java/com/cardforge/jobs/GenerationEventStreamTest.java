package com.cardforge.jobs;

import static org.junit.jupiter.api.Assertions.*;

import com.cardforge.exception.GatewayException;
import com.cardforge.generation.CardGenerationPipeline;
import com.cardforge.generation.DirectCardVerifier;
import com.cardforge.generation.GenerationRequest;
import com.cardforge.generation.NoDuplicateDetector;
import com.cardforge.model.CompletionRequest;
import com.cardforge.model.CompletionResponse;
import com.cardforge.model.ScriptedModelGateway;
import com.cardforge.pipeline.PipelineExecutor;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GenerationEventStreamTest {
  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static CardGenerationPipeline pipeline(ScriptedModelGateway gateway) {
    return new CardGenerationPipeline(
        gateway,
        new NoDuplicateDetector(),
        new DirectCardVerifier(gateway),
        new PipelineExecutor());
  }

  private static List<GenerationEvent> drain(GenerationEventStream stream) {
    List<GenerationEvent> events = new ArrayList<>();
    stream.forEachRemaining(events::add);
    return events;
  }

  @Test
  @DisplayName("A successful run streams progress, every saved card and one completion event")
  void successfulRun() {
    ScriptedModelGateway gateway =
        new ScriptedModelGateway()
            .thenReturn(
                "[{\"front\": \"Q1\", \"back\": \"A1\"},"
                    + " {\"front\": \"Q2\", \"back\": \"A2\"}]");

    List<GenerationEvent> events;
    try (GenerationEventStream stream =
        GenerationEventStream.start(
            pipeline(gateway), GenerationRequest.builder("Tides", "d").build(), executor)) {
      events = drain(stream);
      assertFalse(stream.hasNext());
      assertThrows(NoSuchElementException.class, stream::next);
    }

    GenerationEvent first = events.get(0);
    assertEquals(GenerationEventType.PROGRESS, first.type());
    assertEquals("initializing", first.step());
    assertEquals(0.0, first.progress());

    List<String> steps =
        events.stream()
            .filter(e -> e.type() == GenerationEventType.PROGRESS)
            .map(GenerationEvent::step)
            .toList();
    assertEquals(
        List.of(
            "initializing",
            "fetch_context",
            "generate",
            "check_duplicates",
            "fact_check",
            "route",
            "save"),
        steps);

    List<GenerationEvent> cards =
        events.stream().filter(e -> e.type() == GenerationEventType.CARD).toList();
    assertEquals(2, cards.size());
    assertEquals("Q1", cards.get(0).card().front());

    GenerationEvent last = events.get(events.size() - 1);
    assertEquals(GenerationEventType.COMPLETE, last.type());
    assertEquals(100.0, last.progress());
    assertTrue(last.message().startsWith("Generation completed in "));
  }

  @Test
  @DisplayName("A failed run ends with an error event")
  void failedRun() {
    ScriptedModelGateway gateway =
        new ScriptedModelGateway().thenThrow(new GatewayException("quota exceeded"));

    List<GenerationEvent> events;
    try (GenerationEventStream stream =
        GenerationEventStream.start(
            pipeline(gateway), GenerationRequest.builder("Tides", "d").build(), executor)) {
      events = drain(stream);
    }

    GenerationEvent last = events.get(events.size() - 1);
    assertEquals(GenerationEventType.ERROR, last.type());
    assertEquals("Card generation failed: quota exceeded", last.error());
    assertTrue(events.stream().noneMatch(e -> e.type() == GenerationEventType.CARD));
  }

  @Test
  @DisplayName("Closing the stream cancels the run before its next stage")
  void closeCancelsRun() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    ScriptedModelGateway gateway =
        new ScriptedModelGateway() {
          @Override
          public CompletionResponse generate(CompletionRequest request) {
            entered.countDown();
            try {
              release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return super.generate(request);
          }
        }.thenReturn("[{\"front\": \"Q1\", \"back\": \"A1\"}]");

    GenerationEventStream stream =
        GenerationEventStream.start(
            pipeline(gateway), GenerationRequest.builder("Tides", "d").build(), executor);
    assertTrue(stream.hasNext());
    assertEquals("initializing", stream.next().step());
    assertTrue(entered.await(5, TimeUnit.SECONDS));

    stream.close();
    release.countDown();
    executor.shutdown();
    assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

    assertFalse(stream.hasNext());
    assertTrue(gateway.verifiedClaims().isEmpty());
  }
}
