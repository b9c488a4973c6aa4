package com.cardforge.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void extractErrorMessageUnwrapsExecutorWrappers() {
    Throwable wrapped =
        new CompletionException(new ExecutionException(new GatewayException("model offline")));
    assertEquals("model offline", ExceptionUtil.extractErrorMessage(wrapped));
    assertEquals(
        "IllegalStateException: bad state",
        ExceptionUtil.extractErrorMessage(new IllegalStateException(" bad state ")));
    assertEquals(
        "NullPointerException", ExceptionUtil.extractErrorMessage(new NullPointerException()));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
  }

  @Test
  void errorDetailsKeepCodeAndContext() {
    CardForgeException ex =
        new GatewayException(CardForgeErrorCode.GATEWAY_RATE_LIMITED, "slow down", null)
            .with("retryAfter", "60");
    ErrorDetails details = ExceptionUtil.toErrorDetails(new CompletionException(ex));
    assertEquals("GatewayException", details.type());
    assertEquals(CardForgeErrorCode.GATEWAY_RATE_LIMITED, details.code());
    assertEquals("60", details.context().get("retryAfter"));

    ErrorDetails plain = ExceptionUtil.toErrorDetails(new IllegalArgumentException());
    assertEquals(CardForgeErrorCode.UNKNOWN, plain.code());
    assertEquals("", plain.message());
  }

  @Test
  void rethrowIfUncheckedWrapsForeignExceptions() {
    ValidationException own = new ValidationException("bad");
    assertSame(own, ExceptionUtil.rethrowIfUnchecked(own, t -> new GatewayException("wrapped")));
    CardForgeException wrapped =
        ExceptionUtil.rethrowIfUnchecked(
            new IOException("io"), t -> new GatewayException(t.getMessage(), t));
    assertInstanceOf(GatewayException.class, wrapped);
    assertEquals("io", wrapped.getMessage());
  }

  @Test
  void compactStackTraceIsSingleLine() {
    String trace = ExceptionUtil.formatCompactStackTrace(new RuntimeException("x"), 3);
    assertFalse(trace.contains("\n"));
    assertEquals(3, trace.split(" > ").length);
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null));
  }
}
