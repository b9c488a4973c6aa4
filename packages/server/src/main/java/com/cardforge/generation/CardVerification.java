package com.cardforge.generation;

import java.util.List;

/** Fact-check outcome for the card at {@code cardIndex}. */
public record CardVerification(
    int cardIndex, double confidence, List<String> sources, String reasoning) {

  public CardVerification {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }
}
