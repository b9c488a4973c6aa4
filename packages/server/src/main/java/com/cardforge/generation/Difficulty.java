package com.cardforge.generation;

import com.cardforge.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Difficulty {
  EASY,
  MEDIUM,
  HARD;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }

  @JsonCreator
  public static Difficulty fromValue(String value) {
    for (Difficulty difficulty : values()) {
      if (difficulty.name().equalsIgnoreCase(value)) {
        return difficulty;
      }
    }
    throw new ValidationException("Difficulty must be one of easy, medium, hard: " + value);
  }
}
