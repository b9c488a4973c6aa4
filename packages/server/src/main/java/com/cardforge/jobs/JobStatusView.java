package com.cardforge.jobs;

/**
 * Lightweight status snapshot for polling clients.
 *
 * <p>Progress is 100 for completed jobs and 0 for pending ones. Otherwise it is the last stage
 * percentage the run persisted; a failed job keeps the percentage of the stage that failed. {@code
 * currentStep} is only reported while the job is running.
 */
public record JobStatusView(
    String jobId,
    JobStatus status,
    double progress,
    int generatedCount,
    int requestedCount,
    String currentStep,
    String errorMessage) {

  static final String DEFAULT_STEP = "generating";

  static JobStatusView from(GenerationJob job) {
    double progress =
        switch (job.getStatus()) {
          case COMPLETED -> 100.0;
          case PENDING -> 0.0;
          case RUNNING, FAILED, CANCELLED -> job.persistedProgress();
        };
    String step = null;
    if (job.getStatus() == JobStatus.RUNNING) {
      step = job.currentStep() == null ? DEFAULT_STEP : job.currentStep();
    }
    return new JobStatusView(
        job.getId(),
        job.getStatus(),
        progress,
        job.getGeneratedCount(),
        job.getRequestedCount(),
        step,
        job.getErrorMessage());
  }
}
