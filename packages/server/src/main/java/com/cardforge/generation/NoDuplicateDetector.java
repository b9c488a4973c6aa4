package com.cardforge.generation;

/** Treats every card as new. Used until a deck similarity index is wired in. */
public final class NoDuplicateDetector implements DuplicateDetector {
  @Override
  public DuplicateVerdict check(String deckId, int cardIndex, DraftCard card) {
    return DuplicateVerdict.unique(cardIndex);
  }
}
