package com.cardforge.generation;

import static org.junit.jupiter.api.Assertions.*;

import com.cardforge.exception.GatewayException;
import com.cardforge.model.ClaimVerification;
import com.cardforge.model.CompletionRequest;
import com.cardforge.model.ScriptedModelGateway;
import com.cardforge.pipeline.PipelineContext;
import com.cardforge.pipeline.PipelineExecutor;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CardGenerationPipelineTest {

  private static final String THREE_CARDS =
      """
      ```json
      [
        {"front": "Capital of France?", "back": "Paris", "tags": ["geo"]},
        {"front": "Largest planet?", "back": "Jupiter"},
        {"front": "Red planet?", "back": "Mars"}
      ]
      ```""";

  private static CardGenerationPipeline pipeline(ScriptedModelGateway gateway) {
    return pipeline(gateway, new NoDuplicateDetector());
  }

  private static CardGenerationPipeline pipeline(
      ScriptedModelGateway gateway, DuplicateDetector detector) {
    return new CardGenerationPipeline(
        gateway, detector, new DirectCardVerifier(gateway), new PipelineExecutor());
  }

  private static GenerationRequest.Builder request(int count) {
    return GenerationRequest.builder("Astronomy basics", "deck-1")
        .requestedCount(count)
        .tags(List.of("science"));
  }

  @Test
  @DisplayName("Generated cards are fact-checked, routed and saved up to the requested count")
  void happyPath() {
    ScriptedModelGateway gateway = new ScriptedModelGateway().thenReturn(THREE_CARDS);
    List<String> stages = new ArrayList<>();

    CardGenerationState state =
        pipeline(gateway)
            .run(
                request(2).build(),
                new PipelineContext("job-1", null, (stage, p, s) -> stages.add(stage)));

    assertFalse(state.hasError());
    assertEquals(
        List.of("fetch_context", "generate", "check_duplicates", "fact_check", "route", "save"),
        stages);
    assertEquals(100.0, state.getProgress());
    assertEquals("save", state.getCurrentStep());

    List<GeneratedCard> cards = state.getFinalCards();
    assertEquals(2, cards.size());
    assertEquals("Capital of France?", cards.get(0).front());
    assertEquals(List.of("geo"), cards.get(0).tags());
    assertEquals(List.of("science"), cards.get(1).tags());
    assertEquals(CardType.BASIC, cards.get(1).cardType());
    assertEquals(0.9, cards.get(0).confidence());
    assertEquals("encyclopedia", cards.get(0).source());

    assertEquals(
        List.of(
            "Question: Capital of France?\nAnswer: Paris",
            "Question: Largest planet?\nAnswer: Jupiter"),
        gateway.verifiedClaims());
  }

  @Test
  @DisplayName("The generation call carries the request's prompts, schema and sampling settings")
  void generationRequestShape() {
    ScriptedModelGateway gateway = new ScriptedModelGateway().thenReturn("[]");
    pipeline(gateway)
        .run(
            request(3).context("Jupiter has 95 known moons.").modelId("custom-model").build(),
            PipelineContext.detached());

    CompletionRequest call = gateway.generateCalls().get(0);
    assertEquals("custom-model", call.model());
    assertEquals(CardGenerationPipeline.TEMPERATURE, call.temperature());
    assertEquals(CardGenerationPipeline.MAX_TOKENS, call.maxTokens());
    assertNotNull(call.responseSchema());
    assertTrue(call.userPrompt().contains("Astronomy basics"));
    assertTrue(call.userPrompt().contains("Jupiter has 95 known moons."));
  }

  @Test
  @DisplayName("Output that is not JSON yields zero cards without an error")
  void notJson() {
    ScriptedModelGateway gateway = new ScriptedModelGateway().thenReturn("not json");

    CardGenerationState state =
        pipeline(gateway).run(request(5).build(), PipelineContext.detached());

    assertFalse(state.hasError());
    assertTrue(state.getDraftCards().isEmpty());
    assertTrue(state.getFinalCards().isEmpty());
    assertTrue(gateway.verifiedClaims().isEmpty());
  }

  @Test
  @DisplayName("A gateway failure is recorded and fact-checking is skipped")
  void gatewayFailure() {
    ScriptedModelGateway gateway =
        new ScriptedModelGateway().thenThrow(new GatewayException("service unavailable"));

    CardGenerationState state =
        pipeline(gateway).run(request(5).build(), PipelineContext.detached());

    assertEquals("Card generation failed: service unavailable", state.getError());
    assertTrue(state.getFinalCards().isEmpty());
    assertTrue(gateway.verifiedClaims().isEmpty());
    assertEquals("save", state.getCurrentStep());
  }

  @Test
  @DisplayName("Low-confidence and duplicate cards are rejected")
  void rejections() {
    ScriptedModelGateway gateway =
        new ScriptedModelGateway()
            .thenReturn(THREE_CARDS)
            .verifyingWith(
                (claim, context) ->
                    new ClaimVerification(
                        claim.contains("Mars") ? 0.1 : 0.8, List.of(), "checked"));
    DuplicateDetector firstIsDuplicate =
        (deckId, index, card) ->
            index == 0
                ? new DuplicateVerdict(0, true, 0.97, "existing-card")
                : DuplicateVerdict.unique(index);

    CardGenerationState state =
        pipeline(gateway, firstIsDuplicate).run(request(3).build(), PipelineContext.detached());

    assertEquals(1, state.getApprovedCards().size());
    assertEquals("Largest planet?", state.getApprovedCards().get(0).card().front());
    assertEquals(2, state.getRejectedCards().size());
    assertEquals(RejectionReason.DUPLICATE, state.getRejectedCards().get(0).rejectionReason());
    assertEquals("existing-card", state.getRejectedCards().get(0).duplicateCardId());
    assertEquals(
        RejectionReason.LOW_CONFIDENCE, state.getRejectedCards().get(1).rejectionReason());
    assertEquals(1, state.getFinalCards().size());
    assertNull(state.getFinalCards().get(0).source());
  }

  @Test
  @DisplayName("Disabling fact-checking keeps every card at full confidence")
  void factCheckDisabled() {
    ScriptedModelGateway gateway = new ScriptedModelGateway().thenReturn(THREE_CARDS);

    CardGenerationState state =
        pipeline(gateway)
            .run(request(3).factCheck(false).build(), PipelineContext.detached());

    assertTrue(gateway.verifiedClaims().isEmpty());
    assertTrue(state.getVerifications().isEmpty());
    assertEquals(3, state.getFinalCards().size());
    state.getFinalCards().forEach(card -> assertEquals(1.0, card.confidence()));
  }

  @Test
  @DisplayName("A failing verification counts as 0.5 and keeps the card")
  void verificationFailure() {
    ScriptedModelGateway gateway =
        new ScriptedModelGateway()
            .thenReturn(THREE_CARDS)
            .verifyingWith(
                (claim, context) -> {
                  throw new GatewayException("timeout");
                });

    CardGenerationState state =
        pipeline(gateway).run(request(3).build(), PipelineContext.detached());

    assertFalse(state.hasError());
    assertEquals(3, state.getFinalCards().size());
    assertEquals(0.5, state.getVerifications().get(0).confidence());
    assertEquals("Fact check failed: timeout", state.getVerifications().get(0).reasoning());
  }

  @Test
  @DisplayName("Sources are omitted when the request does not want them")
  void sourcesOmitted() {
    ScriptedModelGateway gateway = new ScriptedModelGateway().thenReturn(THREE_CARDS);

    CardGenerationState state =
        pipeline(gateway)
            .run(request(1).includeSources(false).build(), PipelineContext.detached());

    assertEquals(1, state.getFinalCards().size());
    assertNull(state.getFinalCards().get(0).source());
  }

  @Test
  @DisplayName("Entries without a textual front and back are dropped")
  void parseCardsSkipsIncompleteEntries() {
    List<DraftCard> cards =
        CardGenerationPipeline.parseCards(
            "[{\"front\": \"Q\"}, {\"front\": \" Q2 \", \"back\": \" A2 \"},"
                + " {\"front\": {\"x\": 1}, \"back\": \"A\"}, \"text\"]",
            List.of("default"));
    assertEquals(1, cards.size());
    assertEquals(new DraftCard("Q2", "A2", List.of("default")), cards.get(0));
  }
}
