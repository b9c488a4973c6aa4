package com.cardforge.exception;

/** A job operation that is not allowed in the job's current lifecycle state. */
public class JobStateException extends CardForgeException {
  public JobStateException(String message) {
    super(CardForgeErrorCode.JOB_STATE_ERROR, message);
  }
}
