package com.cardforge.factcheck;

import static com.cardforge.factcheck.FactCheckStage.AGGREGATE;
import static com.cardforge.factcheck.FactCheckStage.PARSE_CLAIMS;
import static com.cardforge.factcheck.FactCheckStage.SEARCH_SOURCES;
import static com.cardforge.factcheck.FactCheckStage.VERIFY_CLAIMS;

import com.cardforge.exception.ExceptionUtil;
import com.cardforge.logging.LoggingService;
import com.cardforge.model.ClaimVerification;
import com.cardforge.model.CompletionRequest;
import com.cardforge.model.CompletionResponse;
import com.cardforge.model.ModelGateway;
import com.cardforge.pipeline.PipelineContext;
import com.cardforge.pipeline.PipelineExecutor;
import com.cardforge.pipeline.PipelineGraph;
import com.cardforge.utility.JacksonUtility;
import com.cardforge.utility.ModelOutputParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;

/**
 * Checks content for factual accuracy.
 *
 * <pre>
 * parse_claims -+-> search_sources -> verify_claims -+-> aggregate
 *               +------------------------------------+
 * </pre>
 *
 * Claims are extracted by the model, verified one by one, and combined with {@link
 * ConfidenceAggregator}. Gateway failures never fail the run: extraction falls back to the whole
 * content as one claim and a failed verification counts as 0.5.
 */
public class FactCheckPipeline {
  private static final Logger log = LoggingService.getLogger(FactCheckPipeline.class);

  static final double EXTRACTION_TEMPERATURE = 0.3;
  static final int EXTRACTION_MAX_TOKENS = 1000;
  static final double FAILED_VERIFICATION_CONFIDENCE = 0.5;

  private static final String CLAIM_FORMAT =
      """

      Respond with a JSON array of claims:
      ```json
      [
          {
              "claim": "The factual statement",
              "type": "historical/scientific/definition/statistic",
              "importance": "high/medium/low"
          }
      ]
      ```""";

  static final String CARD_CLAIMS_PROMPT =
      """
      You are an expert at identifying factual claims in flashcard content.
      Extract all verifiable factual claims from the given question-answer pair.
      Focus on objective, checkable statements rather than opinions or definitions.
      """
          + CLAIM_FORMAT;

  static final String TEXT_CLAIMS_PROMPT =
      """
      You are an expert at identifying factual claims in text.
      Extract all verifiable factual claims from the given content.
      Focus on objective, checkable statements rather than opinions.
      """
          + CLAIM_FORMAT;

  private final ModelGateway gateway;
  private final SourceRetriever sourceRetriever;
  private final PipelineExecutor executor;
  private final PipelineGraph<FactCheckStage, FactCheckState> graph;

  public FactCheckPipeline(
      ModelGateway gateway, SourceRetriever sourceRetriever, PipelineExecutor executor) {
    this.gateway = gateway;
    this.sourceRetriever = sourceRetriever;
    this.executor = executor;
    this.graph =
        PipelineGraph.<FactCheckStage, FactCheckState>builder("fact_check", FactCheckStage.class)
            .entryPoint(PARSE_CLAIMS)
            .addStage(PARSE_CLAIMS, this::parseClaims)
            .addStage(SEARCH_SOURCES, this::searchSources)
            .addStage(VERIFY_CLAIMS, this::verifyClaims)
            .addStage(AGGREGATE, this::aggregate)
            .addConditionalEdges(
                PARSE_CLAIMS,
                ClaimsRoute.class,
                FactCheckPipeline::hasClaims,
                Map.of(ClaimsRoute.CONTINUE, SEARCH_SOURCES, ClaimsRoute.SKIP, AGGREGATE))
            .addEdge(SEARCH_SOURCES, VERIFY_CLAIMS)
            .addEdge(VERIFY_CLAIMS, AGGREGATE)
            .addEdgeToEnd(AGGREGATE)
            .build();
  }

  public FactCheckState run(FactCheckState state, PipelineContext context) {
    return executor.execute(graph, state, context);
  }

  public FactCheckReport check(String content, String context, SourceType sourceType) {
    return check(content, context, sourceType, PipelineContext.detached());
  }

  public FactCheckReport check(
      String content, String context, SourceType sourceType, PipelineContext pipelineContext) {
    return toReport(run(new FactCheckState(content, context, sourceType), pipelineContext));
  }

  public FactCheckReport checkCard(String front, String back, String context) {
    return checkCard(front, back, context, PipelineContext.detached());
  }

  public FactCheckReport checkCard(
      String front, String back, String context, PipelineContext pipelineContext) {
    return check(
        "Question: " + front + "\nAnswer: " + back, context, SourceType.CARD, pipelineContext);
  }

  void parseClaims(FactCheckState state, PipelineContext context) {
    String content = state.getContent();
    log.info("[{}] Parsing claims from {} characters", context.traceId(), content.length());
    if (content.isBlank()) {
      state.setClaims(List.of());
      return;
    }
    if (state.getSourceType() == SourceType.CLAIM) {
      state.setClaims(List.of(new Claim(content, "claim", Importance.MEDIUM)));
      return;
    }

    String systemPrompt =
        state.getSourceType() == SourceType.CARD ? CARD_CLAIMS_PROMPT : TEXT_CLAIMS_PROMPT;
    List<Claim> claims;
    try {
      CompletionResponse response =
          gateway.generate(
              CompletionRequest.of(
                      null,
                      systemPrompt,
                      "Extract claims from:\n" + content,
                      EXTRACTION_TEMPERATURE,
                      EXTRACTION_MAX_TOKENS)
                  .withResponseSchema(claimArraySchema()));
      claims = parseClaimList(response.content());
      if (claims.isEmpty()) {
        log.warn(
            "[{}] No claims could be parsed, checking the content as a whole", context.traceId());
        claims = List.of(wholeContentClaim(content));
      }
    } catch (RuntimeException e) {
      log.error("[{}] Claim parsing failed: {}", context.traceId(), e.getMessage());
      claims = List.of(wholeContentClaim(content));
    }
    log.info("[{}] Claims extracted: {}", context.traceId(), claims.size());
    state.setClaims(claims);
  }

  void searchSources(FactCheckState state, PipelineContext context) {
    log.info("[{}] Searching sources for {} claims", context.traceId(), state.getClaims().size());
    state.setSources(sourceRetriever.retrieve(state.getClaims(), state.getContext()));
  }

  void verifyClaims(FactCheckState state, PipelineContext context) {
    List<Claim> claims = state.getClaims();
    log.info("[{}] Verifying {} claims", context.traceId(), claims.size());
    String sourceText =
        state.getSources().stream().map(Source::content).collect(Collectors.joining("\n"));

    List<VerificationResult> results = new ArrayList<>(claims.size());
    for (int i = 0; i < claims.size(); i++) {
      String claim = claims.get(i).text();
      try {
        ClaimVerification verification = gateway.verifyClaim(claim, sourceText);
        results.add(
            new VerificationResult(
                i,
                claim,
                verification.confidence(),
                verification.sources(),
                verification.reasoning()));
      } catch (RuntimeException e) {
        log.warn("[{}] Verification failed for claim {}: {}", context.traceId(), i, e.getMessage());
        results.add(
            new VerificationResult(
                i,
                claim,
                FAILED_VERIFICATION_CONFIDENCE,
                List.of(),
                "Verification failed: " + ExceptionUtil.extractErrorMessage(e)));
      }
    }
    state.setResults(results);
  }

  void aggregate(FactCheckState state, PipelineContext context) {
    ConfidenceAggregator.Result result =
        ConfidenceAggregator.aggregate(state.getClaims(), state.getResults());
    log.info(
        "[{}] Aggregation complete: confidence {}, verdict {}",
        context.traceId(),
        String.format("%.2f", result.confidence()),
        result.verdict().value());
    state.setAggregate(result);
  }

  static ClaimsRoute hasClaims(FactCheckState state) {
    if (state.hasError() || state.getClaims().isEmpty()) {
      return ClaimsRoute.SKIP;
    }
    return ClaimsRoute.CONTINUE;
  }

  static List<Claim> parseClaimList(String content) {
    List<Claim> claims = new ArrayList<>();
    for (JsonNode node : ModelOutputParser.parseArray(content)) {
      String text =
          node.isTextual() ? node.asText() : node.path("claim").asText("").trim();
      if (text.isBlank()) {
        continue;
      }
      claims.add(
          new Claim(
              text,
              node.path("type").asText(null),
              Importance.fromValue(node.path("importance").asText(null))));
    }
    return claims;
  }

  private static Claim wholeContentClaim(String content) {
    return new Claim(content, Claim.UNKNOWN_TYPE, Importance.MEDIUM);
  }

  private static FactCheckReport toReport(FactCheckState state) {
    ConfidenceAggregator.Result aggregate = state.getAggregate();
    if (aggregate == null) {
      String reason =
          state.isCancelled()
              ? "Fact check was cancelled."
              : state.hasError() ? state.getError() : Verdict.UNVERIFIABLE.description();
      aggregate =
          new ConfidenceAggregator.Result(
              ConfidenceAggregator.NO_CLAIMS_CONFIDENCE, Verdict.UNVERIFIABLE, reason);
    }
    return new FactCheckReport(
        aggregate.confidence(),
        aggregate.verdict(),
        aggregate.summary(),
        state.getClaims(),
        state.getResults());
  }

  private static JsonNode claimArraySchema() {
    ObjectNode schema = JacksonUtility.getJsonMapper().createObjectNode();
    schema.put("type", "array");
    ObjectNode item = schema.putObject("items");
    item.put("type", "object");
    ObjectNode properties = item.putObject("properties");
    properties.putObject("claim").put("type", "string");
    properties.putObject("type").put("type", "string");
    properties
        .putObject("importance")
        .put("type", "string")
        .putArray("enum")
        .add("high")
        .add("medium")
        .add("low");
    item.putArray("required").add("claim");
    return schema;
  }
}
