package com.cardforge.factcheck;

import java.util.List;

/**
 * Combines per-claim confidences into one verdict. Each result is weighted by the importance of
 * its claim (high 1.5, medium 1.0, low 0.5); results without a matching claim count as medium.
 * When the weights sum to zero the plain mean is used.
 */
public final class ConfidenceAggregator {
  public static final double NO_CLAIMS_CONFIDENCE = 0.5;

  private ConfidenceAggregator() {}

  public record Result(double confidence, Verdict verdict, String summary) {}

  public static Result aggregate(List<Claim> claims, List<VerificationResult> results) {
    if (results == null || results.isEmpty()) {
      return new Result(
          NO_CLAIMS_CONFIDENCE, Verdict.UNVERIFIABLE, Verdict.UNVERIFIABLE.description());
    }

    double plainSum = 0.0;
    double weightedSum = 0.0;
    double weightTotal = 0.0;
    for (VerificationResult result : results) {
      int index = result.claimIndex();
      Importance importance =
          claims != null && index >= 0 && index < claims.size()
              ? claims.get(index).importance()
              : Importance.MEDIUM;
      plainSum += result.confidence();
      weightedSum += result.confidence() * importance.weight();
      weightTotal += importance.weight();
    }
    double confidence = weightTotal > 0 ? weightedSum / weightTotal : plainSum / results.size();

    Verdict verdict = Verdict.fromConfidence(confidence);
    long verified = results.stream().filter(VerificationResult::verified).count();
    String summary =
        verified + "/" + results.size() + " claims verified. " + verdict.description();
    return new Result(confidence, verdict, summary);
  }
}
