package com.cardforge.factcheck;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Verification outcome of the claim at {@code claimIndex}. */
public record VerificationResult(
    int claimIndex, String claim, double confidence, List<String> sources, String reasoning) {
  public static final double VERIFIED_THRESHOLD = 0.7;

  public VerificationResult {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }

  @JsonProperty("verified")
  public boolean verified() {
    return confidence >= VERIFIED_THRESHOLD;
  }
}
