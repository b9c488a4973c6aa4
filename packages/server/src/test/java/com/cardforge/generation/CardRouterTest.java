package com.cardforge.generation;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CardRouterTest {
  private static final DraftCard CARD = new DraftCard("Q", "A", List.of());

  @Test
  @DisplayName("A duplicate is rejected even with full confidence")
  void duplicateWins() {
    RoutedCard routed =
        CardRouter.route(
            CARD,
            new DuplicateVerdict(0, true, 0.95, "c-1"),
            new CardVerification(0, 1.0, List.of(), "fine"));
    assertFalse(routed.isApproved());
    assertEquals(RejectionReason.DUPLICATE, routed.rejectionReason());
    assertEquals(0.95, routed.similarityScore());
  }

  @Test
  @DisplayName("Confidence below the threshold is rejected, the threshold itself is approved")
  void confidenceThreshold() {
    RoutedCard low =
        CardRouter.route(
            CARD, DuplicateVerdict.unique(0), new CardVerification(0, 0.29, List.of(), "weak"));
    RoutedCard edge =
        CardRouter.route(
            CARD,
            DuplicateVerdict.unique(0),
            new CardVerification(0, CardRouter.LOW_CONFIDENCE_THRESHOLD, List.of(), "edge"));
    assertEquals(RejectionReason.LOW_CONFIDENCE, low.rejectionReason());
    assertTrue(edge.isApproved());
  }

  @Test
  @DisplayName("Unchecked cards count as fully confident and carry no source")
  void uncheckedCard() {
    RoutedCard routed = CardRouter.route(CARD, null, null);
    assertTrue(routed.isApproved());
    assertEquals(1.0, routed.confidence());
    assertNull(routed.source());
    assertNull(routed.similarityScore());
  }

  @Test
  @DisplayName("Outcomes are matched to cards by index and sources are joined")
  void routeAllMatchesByIndex() {
    List<DraftCard> cards =
        List.of(new DraftCard("Q0", "A0", null), new DraftCard("Q1", "A1", null));
    List<RoutedCard> routed =
        CardRouter.routeAll(
            cards,
            List.of(DuplicateVerdict.unique(1), DuplicateVerdict.unique(0)),
            List.of(new CardVerification(1, 0.7, List.of("book", "paper"), "ok")));

    assertEquals(2, routed.size());
    assertEquals("Q0", routed.get(0).card().front());
    assertEquals(1.0, routed.get(0).confidence());
    assertEquals(0.7, routed.get(1).confidence());
    assertEquals("book, paper", routed.get(1).source());
  }
}
