package com.cardforge.factcheck;

import java.util.List;

/** Outcome of one fact-check run. */
public record FactCheckReport(
    double overallConfidence,
    Verdict verdict,
    String summary,
    List<Claim> claims,
    List<VerificationResult> results) {

  public FactCheckReport {
    claims = claims == null ? List.of() : List.copyOf(claims);
    results = results == null ? List.of() : List.copyOf(results);
  }
}
