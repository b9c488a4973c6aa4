package com.cardforge.exception;

/** A component was used before it was initialized, or after it was shut down. */
public class StateException extends CardForgeException {
  public StateException(String message) {
    super(CardForgeErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(CardForgeErrorCode.STATE_ERROR, message, cause);
  }
}
