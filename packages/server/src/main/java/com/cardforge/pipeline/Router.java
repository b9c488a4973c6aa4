package com.cardforge.pipeline;

/** Chooses the outgoing route of a conditional edge from the current state. */
@FunctionalInterface
public interface Router<S extends PipelineState, R extends Enum<R>> {
  R route(S state);
}
