package com.cardforge.generation;

import static com.cardforge.generation.CardGenerationStage.CHECK_DUPLICATES;
import static com.cardforge.generation.CardGenerationStage.FACT_CHECK;
import static com.cardforge.generation.CardGenerationStage.FETCH_CONTEXT;
import static com.cardforge.generation.CardGenerationStage.GENERATE;
import static com.cardforge.generation.CardGenerationStage.ROUTE;
import static com.cardforge.generation.CardGenerationStage.SAVE;

import com.cardforge.exception.ExceptionUtil;
import com.cardforge.logging.LoggingService;
import com.cardforge.model.ClaimVerification;
import com.cardforge.model.CompletionRequest;
import com.cardforge.model.CompletionResponse;
import com.cardforge.model.ModelGateway;
import com.cardforge.pipeline.PipelineContext;
import com.cardforge.pipeline.PipelineExecutor;
import com.cardforge.pipeline.PipelineGraph;
import com.cardforge.utility.ModelOutputParser;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Turns a {@link GenerationRequest} into reviewed flashcards.
 *
 * <pre>
 * fetch_context -> generate -> check_duplicates -+-> fact_check -+-> route -> save
 *                                                +---------------+
 * </pre>
 *
 * Fact-checking is skipped when generation failed, when the request disables it, or when no card
 * was produced.
 */
public class CardGenerationPipeline {
  private static final Logger log = LoggingService.getLogger(CardGenerationPipeline.class);

  static final double TEMPERATURE = 0.7;
  static final int MAX_TOKENS = 4000;

  private final ModelGateway gateway;
  private final DuplicateDetector duplicateDetector;
  private final CardVerifier cardVerifier;
  private final PipelineExecutor executor;
  private final PipelineGraph<CardGenerationStage, CardGenerationState> graph;

  public CardGenerationPipeline(
      ModelGateway gateway,
      DuplicateDetector duplicateDetector,
      CardVerifier cardVerifier,
      PipelineExecutor executor) {
    this.gateway = gateway;
    this.duplicateDetector = duplicateDetector;
    this.cardVerifier = cardVerifier;
    this.executor = executor;
    this.graph = buildGraph();
  }

  private PipelineGraph<CardGenerationStage, CardGenerationState> buildGraph() {
    return PipelineGraph.<CardGenerationStage, CardGenerationState>builder(
            "card_generation", CardGenerationStage.class)
        .entryPoint(FETCH_CONTEXT)
        .addStage(FETCH_CONTEXT, this::fetchContext)
        .addStage(GENERATE, this::generate)
        .addStage(CHECK_DUPLICATES, this::checkDuplicates)
        .addStage(FACT_CHECK, this::factCheck)
        .addStage(ROUTE, this::route)
        .addStage(SAVE, this::save)
        .addEdge(FETCH_CONTEXT, GENERATE)
        .addEdge(GENERATE, CHECK_DUPLICATES)
        .addConditionalEdges(
            CHECK_DUPLICATES,
            FactCheckRoute.class,
            CardGenerationPipeline::shouldFactCheck,
            Map.of(FactCheckRoute.FACT_CHECK, FACT_CHECK, FactCheckRoute.SKIP, ROUTE))
        .addEdge(FACT_CHECK, ROUTE)
        .addEdge(ROUTE, SAVE)
        .addEdgeToEnd(SAVE)
        .build();
  }

  public CardGenerationState run(GenerationRequest request, PipelineContext context) {
    return run(new CardGenerationState(request), context);
  }

  /** Run the pipeline over a caller-created state, which is returned once the run ends. */
  public CardGenerationState run(CardGenerationState state, PipelineContext context) {
    return executor.execute(graph, state, context);
  }

  void fetchContext(CardGenerationState state, PipelineContext context) {
    GenerationRequest request = state.getRequest();
    log.info("[{}] Fetching context for topic '{}'", context.traceId(), request.topic());
    List<ContextItem> items = new ArrayList<>();
    if (request.hasContext()) {
      items.add(ContextItem.userProvided(request.context()));
    }
    state.setContextItems(items);
  }

  void generate(CardGenerationState state, PipelineContext context) {
    GenerationRequest request = state.getRequest();
    log.info(
        "[{}] Generating {} cards about '{}'",
        context.traceId(),
        request.requestedCount(),
        request.topic());

    CompletionRequest completion =
        CompletionRequest.of(
                request.modelId(),
                CardPrompts.systemPrompt(
                    request.cardType(), request.difficulty(), request.language()),
                CardPrompts.userPrompt(
                    request.topic(),
                    request.requestedCount(),
                    state.getContextItems(),
                    request.tags()),
                TEMPERATURE,
                MAX_TOKENS)
            .withResponseSchema(CardPrompts.cardArraySchema());
    try {
      CompletionResponse response = gateway.generate(completion);
      state.setRawGeneration(response.content());
      List<DraftCard> cards = parseCards(response.content(), request.tags());
      if (cards.size() > request.requestedCount()) {
        log.debug(
            "[{}] Model returned {} cards, keeping the first {}",
            context.traceId(),
            cards.size(),
            request.requestedCount());
        cards = cards.subList(0, request.requestedCount());
      }
      state.setDraftCards(cards);
      log.info("[{}] Cards generated: {}", context.traceId(), cards.size());
    } catch (RuntimeException e) {
      log.error("[{}] Card generation failed: {}", context.traceId(), e.getMessage());
      state.setDraftCards(List.of());
      state.fail("Card generation failed: " + ExceptionUtil.extractErrorMessage(e));
    }
  }

  void checkDuplicates(CardGenerationState state, PipelineContext context) {
    List<DraftCard> cards = state.getDraftCards();
    log.info("[{}] Checking duplicates for {} cards", context.traceId(), cards.size());
    String deckId = state.getRequest().deckId();
    List<DuplicateVerdict> verdicts = new ArrayList<>(cards.size());
    for (int i = 0; i < cards.size(); i++) {
      verdicts.add(duplicateDetector.check(deckId, i, cards.get(i)));
    }
    state.setDuplicateVerdicts(verdicts);
  }

  void factCheck(CardGenerationState state, PipelineContext context) {
    List<DraftCard> cards = state.getDraftCards();
    log.info("[{}] Fact-checking {} cards", context.traceId(), cards.size());
    String groundingContext = state.getRequest().context();
    List<CardVerification> results = new ArrayList<>(cards.size());
    for (int i = 0; i < cards.size(); i++) {
      try {
        ClaimVerification verification =
            cardVerifier.verify(cards.get(i), groundingContext, context);
        results.add(
            new CardVerification(
                i, verification.confidence(), verification.sources(), verification.reasoning()));
      } catch (RuntimeException e) {
        log.warn("[{}] Fact check failed for card {}: {}", context.traceId(), i, e.getMessage());
        results.add(
            new CardVerification(
                i, 0.5, List.of(), "Fact check failed: " + ExceptionUtil.extractErrorMessage(e)));
      }
    }
    state.setVerifications(results);
  }

  void route(CardGenerationState state, PipelineContext context) {
    state.setRoutedCards(
        CardRouter.routeAll(
            state.getDraftCards(), state.getDuplicateVerdicts(), state.getVerifications()));
    log.info(
        "[{}] Cards routed: {} approved, {} rejected",
        context.traceId(),
        state.getApprovedCards().size(),
        state.getRejectedCards().size());
  }

  void save(CardGenerationState state, PipelineContext context) {
    GenerationRequest request = state.getRequest();
    List<GeneratedCard> finalCards = new ArrayList<>();
    for (RoutedCard routed : state.getApprovedCards()) {
      DraftCard card = routed.card();
      finalCards.add(
          new GeneratedCard(
              card.front(),
              card.back(),
              request.cardType(),
              card.tags().isEmpty() ? request.tags() : card.tags(),
              request.includeSources() ? routed.source() : null,
              routed.confidence(),
              routed.duplicate(),
              routed.duplicateCardId(),
              routed.similarityScore()));
    }
    state.setFinalCards(finalCards);
    log.info("[{}] Saved {} cards", context.traceId(), finalCards.size());
  }

  static FactCheckRoute shouldFactCheck(CardGenerationState state) {
    if (state.hasError()
        || !state.getRequest().factCheck()
        || state.getDraftCards().isEmpty()) {
      return FactCheckRoute.SKIP;
    }
    return FactCheckRoute.FACT_CHECK;
  }

  /**
   * Extract cards from model output. Entries without a textual front or back are dropped; entries
   * without tags inherit {@code defaultTags}. Never throws.
   */
  static List<DraftCard> parseCards(String content, List<String> defaultTags) {
    List<DraftCard> cards = new ArrayList<>();
    for (JsonNode node : ModelOutputParser.parseArray(content)) {
      if (!node.isObject()) {
        continue;
      }
      JsonNode front = node.get("front");
      JsonNode back = node.get("back");
      if (front == null || back == null || front.isNull() || back.isNull()
          || front.isContainerNode() || back.isContainerNode()) {
        continue;
      }
      List<String> tags = new ArrayList<>();
      JsonNode tagsNode = node.get("tags");
      if (tagsNode != null && tagsNode.isArray()) {
        tagsNode.forEach(t -> tags.add(t.asText()));
      } else {
        tags.addAll(defaultTags);
      }
      cards.add(new DraftCard(front.asText().trim(), back.asText().trim(), tags));
    }
    return cards;
  }
}
