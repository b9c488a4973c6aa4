package com.cardforge.pipeline;

/** Cooperative cancellation check, consulted by the executor before every stage. */
@FunctionalInterface
public interface CancellationSignal {
  CancellationSignal NEVER = () -> false;

  boolean isCancelled();
}
