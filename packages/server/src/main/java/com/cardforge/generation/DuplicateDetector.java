package com.cardforge.generation;

/** Compares a freshly generated card with the cards already in the target deck. */
public interface DuplicateDetector {
  DuplicateVerdict check(String deckId, int cardIndex, DraftCard card);
}
