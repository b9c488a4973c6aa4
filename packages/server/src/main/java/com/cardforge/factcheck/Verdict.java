package com.cardforge.factcheck;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Verdict {
  VERIFIED("verified", "The content appears to be factually accurate."),
  LIKELY_ACCURATE("likely_accurate", "The content is mostly accurate with minor uncertainties."),
  UNCERTAIN(
      "uncertain", "The content has mixed accuracy. Some claims could not be verified."),
  LIKELY_INACCURATE("likely_inaccurate", "The content contains significant inaccuracies."),
  FALSE("false", "The content appears to contain false information."),
  UNVERIFIABLE("unverifiable", "No claims could be extracted for verification.");

  private final String value;
  private final String description;

  Verdict(String value, String description) {
    this.value = value;
    this.description = description;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** One-sentence explanation used in report summaries. */
  public String description() {
    return description;
  }

  public static Verdict fromConfidence(double confidence) {
    if (confidence >= 0.8) {
      return VERIFIED;
    } else if (confidence >= 0.6) {
      return LIKELY_ACCURATE;
    } else if (confidence >= 0.4) {
      return UNCERTAIN;
    } else if (confidence >= 0.2) {
      return LIKELY_INACCURATE;
    }
    return FALSE;
  }
}
