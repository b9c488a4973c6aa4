package com.cardforge.exception;

/** The job store could not read or write a record. */
public class JobStoreException extends CardForgeException {
  public JobStoreException(String message, Throwable cause) {
    super(CardForgeErrorCode.JOB_STORE_ERROR, message, cause);
  }
}
