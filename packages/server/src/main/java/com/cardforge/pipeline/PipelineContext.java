package com.cardforge.pipeline;

import com.cardforge.logging.LoggingService;
import java.util.UUID;
import org.slf4j.Logger;

/**
 * Per-run collaborators handed to every stage: the cancellation signal, the progress sink and a
 * trace id used in log lines. Kept out of {@link PipelineState} so the state stays plain data.
 */
public final class PipelineContext {
  private static final Logger log = LoggingService.getLogger(PipelineContext.class);

  private final String traceId;
  private final CancellationSignal cancellationSignal;
  private final ProgressSink progressSink;

  public PipelineContext(
      String traceId, CancellationSignal cancellationSignal, ProgressSink progressSink) {
    this.traceId = traceId == null ? UUID.randomUUID().toString() : traceId;
    this.cancellationSignal =
        cancellationSignal == null ? CancellationSignal.NEVER : cancellationSignal;
    this.progressSink = progressSink == null ? ProgressSink.NONE : progressSink;
  }

  /** A context that is never cancelled and reports progress nowhere. */
  public static PipelineContext detached() {
    return new PipelineContext(null, CancellationSignal.NEVER, ProgressSink.NONE);
  }

  /** A context for a nested run: same trace id and cancellation, no progress reporting. */
  public PipelineContext nested() {
    return new PipelineContext(traceId, cancellationSignal, ProgressSink.NONE);
  }

  public String traceId() {
    return traceId;
  }

  public boolean isCancelled() {
    try {
      return cancellationSignal.isCancelled();
    } catch (RuntimeException e) {
      log.warn("[{}] Cancellation check failed, continuing: {}", traceId, e.getMessage());
      return false;
    }
  }

  /** Notify the sink. Failures are logged and never abort the run. */
  void reportProgress(String stage, double progress, PipelineState state) {
    try {
      progressSink.onStageCompleted(stage, progress, state);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[{}] Interrupted while reporting progress for stage {}", traceId, stage);
    } catch (Exception e) {
      log.warn("[{}] Progress callback failed for stage {}: {}", traceId, stage, e.getMessage());
    }
  }
}
