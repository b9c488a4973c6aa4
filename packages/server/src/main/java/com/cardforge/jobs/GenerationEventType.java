package com.cardforge.jobs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GenerationEventType {
  PROGRESS,
  CARD,
  COMPLETE,
  ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  /** A terminal event is the last one a stream yields. */
  public boolean isTerminal() {
    return this == COMPLETE || this == ERROR;
  }
}
