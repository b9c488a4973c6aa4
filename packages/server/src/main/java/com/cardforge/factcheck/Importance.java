package com.cardforge.factcheck;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How much a claim counts towards the aggregated confidence. */
public enum Importance {
  HIGH(1.5),
  MEDIUM(1.0),
  LOW(0.5);

  private final double weight;

  Importance(double weight) {
    this.weight = weight;
  }

  public double weight() {
    return weight;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  /** Lenient lookup: anything unrecognized counts as {@link #MEDIUM}. */
  @JsonCreator
  public static Importance fromValue(String value) {
    if (value != null) {
      for (Importance importance : values()) {
        if (importance.name().equalsIgnoreCase(value.trim())) {
          return importance;
        }
      }
    }
    return MEDIUM;
  }
}
