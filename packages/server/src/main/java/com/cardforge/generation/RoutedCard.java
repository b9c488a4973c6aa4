package com.cardforge.generation;

/**
 * A draft enriched with its duplicate and fact-check outcomes.
 *
 * @param rejectionReason {@code null} when the card was approved
 */
public record RoutedCard(
    DraftCard card,
    boolean duplicate,
    String duplicateCardId,
    Double similarityScore,
    double confidence,
    String source,
    RejectionReason rejectionReason) {

  public boolean isApproved() {
    return rejectionReason == null;
  }
}
