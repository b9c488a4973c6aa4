package com.cardforge.factcheck;

import com.fasterxml.jackson.annotation.JsonValue;

/** Kind of content submitted for fact-checking. */
public enum SourceType {
  /** A flashcard question/answer pair. */
  CARD,
  /** Free text, possibly holding many claims. */
  TEXT,
  /** A single, already atomic claim; extraction is skipped. */
  CLAIM;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }
}
