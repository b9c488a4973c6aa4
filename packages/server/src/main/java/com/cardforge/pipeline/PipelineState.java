package com.cardforge.pipeline;

/**
 * Bookkeeping shared by every pipeline run: progress, the last stage, a terminal error and the
 * cancelled marker. Concrete pipelines extend this with their stage outputs.
 *
 * <p>A state belongs to exactly one run and is never shared between threads while that run is in
 * progress.
 */
public abstract class PipelineState {
  private double progress;
  private String currentStep = "init";
  private String error;
  private boolean cancelled;

  public double getProgress() {
    return progress;
  }

  public String getCurrentStep() {
    return currentStep;
  }

  public String getError() {
    return error;
  }

  public boolean hasError() {
    return error != null;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /** Record an error. The run continues unless the stage also throws; routers may inspect it. */
  public void fail(String message) {
    this.error = message == null ? "Unknown error" : message;
  }

  void completeStage(String stage, double stageProgress) {
    this.currentStep = stage;
    this.progress = stageProgress;
  }

  void markCancelled(String stage) {
    this.currentStep = stage;
    this.cancelled = true;
  }
}
