package com.cardforge.generation;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Decides which cards are kept. A duplicate is always rejected; otherwise a card whose
 * fact-check confidence is below {@value #LOW_CONFIDENCE_THRESHOLD} is rejected. Cards that were
 * never fact-checked count as fully confident.
 */
public final class CardRouter {
  public static final double LOW_CONFIDENCE_THRESHOLD = 0.3;

  private CardRouter() {}

  public static List<RoutedCard> routeAll(
      List<DraftCard> cards,
      List<DuplicateVerdict> duplicateVerdicts,
      List<CardVerification> verifications) {
    Map<Integer, DuplicateVerdict> verdictByIndex =
        duplicateVerdicts.stream()
            .collect(
                Collectors.toMap(DuplicateVerdict::cardIndex, Function.identity(), (a, b) -> a));
    Map<Integer, CardVerification> verificationByIndex =
        verifications.stream()
            .collect(
                Collectors.toMap(CardVerification::cardIndex, Function.identity(), (a, b) -> a));
    return IntStream.range(0, cards.size())
        .mapToObj(i -> route(cards.get(i), verdictByIndex.get(i), verificationByIndex.get(i)))
        .toList();
  }

  /**
   * Route a single card.
   *
   * @param verdict duplicate verdict, or {@code null} when none was produced
   * @param verification fact-check outcome, or {@code null} when the card was not checked
   */
  public static RoutedCard route(
      DraftCard card, DuplicateVerdict verdict, CardVerification verification) {
    boolean duplicate = verdict != null && verdict.duplicate();
    double confidence = verification == null ? 1.0 : verification.confidence();
    String source =
        verification == null || verification.sources().isEmpty()
            ? null
            : String.join(", ", verification.sources());

    RejectionReason reason = null;
    if (duplicate) {
      reason = RejectionReason.DUPLICATE;
    } else if (confidence < LOW_CONFIDENCE_THRESHOLD) {
      reason = RejectionReason.LOW_CONFIDENCE;
    }
    return new RoutedCard(
        card,
        duplicate,
        verdict == null ? null : verdict.duplicateCardId(),
        verdict == null ? null : verdict.similarityScore(),
        confidence,
        source,
        reason);
  }
}
