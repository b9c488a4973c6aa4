package com.cardforge.pipeline;

/** Work performed by one stage. Mutates the run's state in place. */
@FunctionalInterface
public interface StageAction<S extends PipelineState> {
  void apply(S state, PipelineContext context) throws Exception;
}
