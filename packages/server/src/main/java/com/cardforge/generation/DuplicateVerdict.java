package com.cardforge.generation;

/** Outcome of the duplicate check for the card at {@code cardIndex}. */
public record DuplicateVerdict(
    int cardIndex, boolean duplicate, double similarityScore, String duplicateCardId) {

  public static DuplicateVerdict unique(int cardIndex) {
    return new DuplicateVerdict(cardIndex, false, 0.0, null);
  }
}
