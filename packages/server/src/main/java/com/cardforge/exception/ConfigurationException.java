package com.cardforge.exception;

/** Missing or invalid application configuration. */
public class ConfigurationException extends CardForgeException {
  public ConfigurationException(String message) {
    super(CardForgeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(CardForgeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
