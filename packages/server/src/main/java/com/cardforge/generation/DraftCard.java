package com.cardforge.generation;

import java.util.List;

/** A card as parsed from model output, before duplicate checks and fact-checking. */
public record DraftCard(String front, String back, List<String> tags) {

  public DraftCard {
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  /** The card rendered as a single verifiable statement. */
  public String asClaim() {
    return "Question: " + front + "\nAnswer: " + back;
  }
}
