package com.cardforge.pipeline;

/** Receives a notification after every completed stage. */
@FunctionalInterface
public interface ProgressSink {
  ProgressSink NONE = (stage, progress, state) -> {};

  /**
   * @param stage name of the stage that just finished
   * @param progress overall completion percentage
   * @param state the run's state, as left by the stage
   */
  void onStageCompleted(String stage, double progress, PipelineState state) throws Exception;
}
