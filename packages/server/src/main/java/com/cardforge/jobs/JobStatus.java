package com.cardforge.jobs;

/** Lifecycle state of a generation job. */
public enum JobStatus {
  /** Job accepted but not yet executed. */
  PENDING,
  /** Job is currently executing. */
  RUNNING,
  /** Job finished successfully. */
  COMPLETED,
  /** Job failed permanently. */
  FAILED,
  /** Job was cancelled by user request. */
  CANCELLED;

  /** Terminal states are final: a job never leaves them. */
  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }
}
