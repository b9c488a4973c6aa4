package com.cardforge.exception;

/** A request that violates its declared constraints. */
public class ValidationException extends CardForgeException {
  public ValidationException(String message) {
    super(CardForgeErrorCode.VALIDATION_ERROR, message);
  }
}
