package com.cardforge.pipeline;

/**
 * Identity of a pipeline stage. Implemented by one enum per pipeline, so the set of stages is
 * fixed at compile time.
 */
public interface StageId {

  /** Name reported in progress updates and persisted as the job's current step. */
  String stageName();

  /** Overall completion percentage once this stage has finished. */
  double progress();
}
