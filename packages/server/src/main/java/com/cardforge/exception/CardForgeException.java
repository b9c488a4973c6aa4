package com.cardforge.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the application exception hierarchy. Carries a {@link CardForgeErrorCode} and an
 * optional context map with structured details that can be logged or rendered without exposing a
 * stack trace.
 */
public class CardForgeException extends RuntimeException {
  private final CardForgeErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public CardForgeException(CardForgeErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public CardForgeException(CardForgeErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public CardForgeErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context entry and return this exception for fluent use at the throw site. */
  public CardForgeException with(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
