package com.cardforge.generation;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RejectionReason {
  DUPLICATE("duplicate"),
  LOW_CONFIDENCE("low_confidence");

  private final String value;

  RejectionReason(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
