package com.cardforge.factcheck;

/**
 * A verifiable statement extracted from content.
 *
 * @param type free-form category reported by the model, e.g. {@code historical}
 */
public record Claim(String text, String type, Importance importance) {
  public static final String UNKNOWN_TYPE = "unknown";

  public Claim {
    type = type == null || type.isBlank() ? UNKNOWN_TYPE : type;
    importance = importance == null ? Importance.MEDIUM : importance;
  }
}
