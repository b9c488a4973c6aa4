package com.cardforge.generation;

import com.cardforge.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Anki note type produced by the generator. */
public enum CardType {
  BASIC("basic"),
  CLOZE("cloze"),
  BASIC_REVERSED("basic_reversed");

  private final String value;

  CardType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static CardType fromValue(String value) {
    for (CardType type : values()) {
      if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new ValidationException("Unknown card type: " + value);
  }
}
