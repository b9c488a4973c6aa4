package com.cardforge.pipeline;

import com.cardforge.exception.ExceptionUtil;
import com.cardforge.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Runs a {@link PipelineGraph} over a state, one stage at a time.
 *
 * <p>Before each stage the context's cancellation signal is checked; a cancelled run stops there
 * with {@link PipelineState#isCancelled()} set. After each stage the progress sink is notified. A
 * stage that throws halts the run and its message is recorded with {@link
 * PipelineState#fail(String)}: {@link #execute} itself never throws for stage failures.
 */
public class PipelineExecutor {
  private static final Logger log = LoggingService.getLogger(PipelineExecutor.class);

  public static final int DEFAULT_MAX_STEPS = 25;

  private final int maxSteps;

  public PipelineExecutor() {
    this(DEFAULT_MAX_STEPS);
  }

  public PipelineExecutor(int maxSteps) {
    if (maxSteps <= 0) {
      throw new IllegalArgumentException("maxSteps must be positive");
    }
    this.maxSteps = maxSteps;
  }

  public <K extends Enum<K> & StageId, S extends PipelineState> S execute(
      PipelineGraph<K, S> graph, S state, PipelineContext context) {
    log.info("[{}] Starting pipeline {}", context.traceId(), graph.name());
    long start = System.currentTimeMillis();

    K current = graph.entryPoint();
    int steps = 0;
    while (current != null) {
      if (++steps > maxSteps) {
        state.fail("Pipeline " + graph.name() + " exceeded the limit of " + maxSteps + " steps");
        log.error("[{}] {}", context.traceId(), state.getError());
        break;
      }
      if (context.isCancelled()) {
        state.markCancelled(current.stageName());
        log.info(
            "[{}] Pipeline {} cancelled before stage {}",
            context.traceId(),
            graph.name(),
            current.stageName());
        return state;
      }

      log.debug("[{}] Executing stage: {}", context.traceId(), current.stageName());
      try {
        graph.action(current).apply(state, context);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        state.fail("Stage " + current.stageName() + " was interrupted");
        log.warn("[{}] {}", context.traceId(), state.getError());
        break;
      } catch (Exception e) {
        state.fail(ExceptionUtil.extractErrorMessage(e));
        log.error(
            "[{}] Stage {} failed: {} ({})",
            context.traceId(),
            current.stageName(),
            state.getError(),
            ExceptionUtil.formatCompactStackTrace(e, 5));
        break;
      }

      state.completeStage(current.stageName(), current.progress());
      context.reportProgress(current.stageName(), current.progress(), state);
      try {
        current = graph.next(current, state).orElse(null);
      } catch (RuntimeException e) {
        state.fail(ExceptionUtil.extractErrorMessage(e));
        log.error("[{}] Routing after stage {} failed", context.traceId(), current.stageName(), e);
        break;
      }
    }

    if (state.hasError()) {
      log.warn(
          "[{}] Pipeline {} finished with error after {} ms: {}",
          context.traceId(),
          graph.name(),
          System.currentTimeMillis() - start,
          state.getError());
    } else {
      log.info(
          "[{}] Pipeline {} completed in {} ms",
          context.traceId(),
          graph.name(),
          System.currentTimeMillis() - start);
    }
    return state;
  }
}
