package com.cardforge.exception;

/** Transport, timeout or protocol failure reported by a model gateway. */
public class GatewayException extends CardForgeException {
  public GatewayException(String message) {
    super(CardForgeErrorCode.GATEWAY_ERROR, message);
  }

  public GatewayException(String message, Throwable cause) {
    super(CardForgeErrorCode.GATEWAY_ERROR, message, cause);
  }

  public GatewayException(CardForgeErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }
}
