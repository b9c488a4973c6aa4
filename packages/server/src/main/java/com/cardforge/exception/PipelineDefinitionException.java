package com.cardforge.exception;

/** A pipeline graph that cannot be executed: unknown stages, dangling or duplicate edges. */
public class PipelineDefinitionException extends CardForgeException {
  public PipelineDefinitionException(String message) {
    super(CardForgeErrorCode.PIPELINE_DEFINITION_ERROR, message);
  }
}
