package com.cardforge.generation;

import java.util.List;

/**
 * A card that passed routing, as handed back to callers and persisted on the job.
 *
 * @param source comma-separated citations, or {@code null}
 * @param confidence fact-check confidence in [0, 1], 1.0 when the card was not checked
 * @param similarityScore similarity to the nearest existing card in [0, 1]
 */
public record GeneratedCard(
    String front,
    String back,
    CardType cardType,
    List<String> tags,
    String source,
    Double confidence,
    boolean duplicate,
    String duplicateCardId,
    Double similarityScore) {

  public GeneratedCard {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }
}
