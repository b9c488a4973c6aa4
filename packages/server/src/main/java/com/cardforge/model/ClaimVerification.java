package com.cardforge.model;

import java.util.List;

/** The gateway's opinion on a single claim. Confidence is clamped to [0, 1]. */
public record ClaimVerification(double confidence, List<String> sources, String reasoning) {

  public ClaimVerification {
    if (Double.isNaN(confidence)) {
      confidence = 0.5;
    }
    confidence = Math.max(0.0, Math.min(1.0, confidence));
    sources = sources == null ? List.of() : List.copyOf(sources);
    reasoning = reasoning == null ? "" : reasoning;
  }
}
