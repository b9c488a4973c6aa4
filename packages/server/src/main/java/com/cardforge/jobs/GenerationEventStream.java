package com.cardforge.jobs;

import com.cardforge.exception.ExceptionUtil;
import com.cardforge.generation.CardGenerationPipeline;
import com.cardforge.generation.CardGenerationState;
import com.cardforge.generation.GeneratedCard;
import com.cardforge.generation.GenerationRequest;
import com.cardforge.logging.LoggingService;
import com.cardforge.pipeline.PipelineContext;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Live events of one independent card generation run.
 *
 * <p>The run executes on a worker thread and hands events over through an unbounded queue, so a
 * slow consumer only delays itself. Iteration blocks until the next event arrives and ends after
 * the terminal {@code complete} or {@code error} event. Closing the stream cancels the run at the
 * next stage boundary; events not yet consumed are lost.
 */
public final class GenerationEventStream implements Iterator<GenerationEvent>, AutoCloseable {
  private static final Logger log = LoggingService.getLogger(GenerationEventStream.class);

  private final BlockingQueue<GenerationEvent> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final String streamId = UUID.randomUUID().toString();
  private GenerationEvent pending;
  private boolean finished;

  private GenerationEventStream() {}

  static GenerationEventStream start(
      CardGenerationPipeline pipeline, GenerationRequest request, ExecutorService executor) {
    GenerationEventStream stream = new GenerationEventStream();
    executor.execute(() -> stream.produce(pipeline, request));
    return stream;
  }

  public String streamId() {
    return streamId;
  }

  private void produce(CardGenerationPipeline pipeline, GenerationRequest request) {
    long start = System.nanoTime();
    try (MDC.MDCCloseable ignored = MDC.putCloseable("jobId", streamId)) {
      emit(GenerationEvent.progress("initializing", 0.0, "Starting card generation..."));

      CardGenerationState state = new CardGenerationState(request);
      int[] emittedCards = {0};
      pipeline.run(
          state,
          new PipelineContext(
              streamId,
              closed::get,
              (stage, progress, s) -> {
                emit(GenerationEvent.progress(stage, progress, null));
                List<GeneratedCard> cards = state.getFinalCards();
                for (int i = emittedCards[0]; i < cards.size(); i++) {
                  emit(GenerationEvent.card(cards.get(i), progress));
                }
                emittedCards[0] = Math.max(emittedCards[0], cards.size());
              }));

      if (state.isCancelled()) {
        emit(GenerationEvent.error("Generation was cancelled"));
      } else if (state.hasError()) {
        emit(GenerationEvent.error(state.getError()));
      } else {
        double seconds = (System.nanoTime() - start) / 1e9;
        emit(
            GenerationEvent.complete(
                String.format(Locale.ROOT, "Generation completed in %.1fs", seconds)));
      }
    } catch (RuntimeException e) {
      log.error("Stream generation failed: {}", e.getMessage(), e);
      emit(GenerationEvent.error(ExceptionUtil.extractErrorMessage(e)));
    }
  }

  private void emit(GenerationEvent event) {
    if (!closed.get()) {
      queue.add(event);
    }
  }

  @Override
  public boolean hasNext() {
    if (pending != null) {
      return true;
    }
    if (finished || closed.get()) {
      return false;
    }
    try {
      pending = queue.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      close();
      return false;
    }
    if (pending.type().isTerminal()) {
      finished = true;
    }
    return true;
  }

  @Override
  public GenerationEvent next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    GenerationEvent event = pending;
    pending = null;
    return event;
  }

  /** Stop consuming. The underlying run is cancelled before its next stage. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      log.debug("Stream {} closed by consumer", streamId);
      queue.clear();
    }
  }
}
