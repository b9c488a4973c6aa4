package com.cardforge.exception;

/** Stable error codes attached to every {@link CardForgeException}. */
public enum CardForgeErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  VALIDATION_ERROR,
  STATE_ERROR,
  GATEWAY_ERROR,
  GATEWAY_TIMEOUT,
  GATEWAY_RATE_LIMITED,
  PIPELINE_DEFINITION_ERROR,
  JOB_STATE_ERROR,
  JOB_STORE_ERROR
}
