package com.cardforge.factcheck;

import static org.junit.jupiter.api.Assertions.*;

import com.cardforge.exception.GatewayException;
import com.cardforge.model.ClaimVerification;
import com.cardforge.model.ScriptedModelGateway;
import com.cardforge.pipeline.PipelineContext;
import com.cardforge.pipeline.PipelineExecutor;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FactCheckPipelineTest {

  private static FactCheckPipeline pipeline(ScriptedModelGateway gateway) {
    return new FactCheckPipeline(gateway, new ContextSourceRetriever(), new PipelineExecutor());
  }

  @Test
  @DisplayName("Extracted claims are verified against the provided context and aggregated")
  void fullRun() {
    ScriptedModelGateway gateway =
        new ScriptedModelGateway()
            .thenReturn(
                """
                [
                  {"claim": "Paris is the capital of France",
                   "type": "geography", "importance": "high"},
                  {"claim": "Paris has 2 million inhabitants", "importance": "low"}
                ]""")
            .verifyingWith(
                (claim, context) ->
                    new ClaimVerification(
                        claim.contains("capital") ? 0.95 : 0.5, List.of("atlas"), context));

    FactCheckReport report =
        pipeline(gateway).checkCard("Capital of France?", "Paris", "Paris is in France.");

    assertEquals(2, report.claims().size());
    assertEquals(Importance.HIGH, report.claims().get(0).importance());
    assertEquals(Claim.UNKNOWN_TYPE, report.claims().get(1).type());
    assertEquals(2, report.results().size());
    assertEquals("Paris is in France.", report.results().get(0).reasoning());
    // (0.95 * 1.5 + 0.5 * 0.5) / 2.0
    assertEquals(0.8375, report.overallConfidence(), 1e-9);
    assertEquals(Verdict.VERIFIED, report.verdict());
    assertTrue(report.summary().startsWith("1/2 claims verified."));
    assertTrue(
        gateway.generateCalls().get(0).userPrompt().contains("Question: Capital of France?"));
    assertEquals(
        FactCheckPipeline.CARD_CLAIMS_PROMPT, gateway.generateCalls().get(0).systemPrompt());
  }

  @Test
  @DisplayName("Empty content is unverifiable without calling the gateway")
  void emptyContent() {
    ScriptedModelGateway gateway = new ScriptedModelGateway();
    FactCheckReport report = pipeline(gateway).check("", null, SourceType.TEXT);
    assertEquals(0.5, report.overallConfidence());
    assertEquals(Verdict.UNVERIFIABLE, report.verdict());
    assertEquals(0, gateway.callCount());
  }

  @Test
  @DisplayName("Failed extraction falls back to the whole content as one claim")
  void extractionFallback() {
    ScriptedModelGateway gateway =
        new ScriptedModelGateway().thenThrow(new GatewayException("down"));

    FactCheckReport report =
        pipeline(gateway).check("Water boils at 100C.", null, SourceType.TEXT);

    assertEquals(1, report.claims().size());
    assertEquals("Water boils at 100C.", report.claims().get(0).text());
    assertEquals(List.of("Water boils at 100C."), gateway.verifiedClaims());
  }

  @Test
  @DisplayName("Unparseable extraction output also falls back to one claim")
  void unparseableExtraction() {
    ScriptedModelGateway gateway = new ScriptedModelGateway().thenReturn("I found no claims.");
    FactCheckReport report = pipeline(gateway).check("Some text", null, SourceType.TEXT);
    assertEquals(1, report.claims().size());
  }

  @Test
  @DisplayName("A single claim is verified directly, without extraction")
  void singleClaim() {
    ScriptedModelGateway gateway = new ScriptedModelGateway();
    FactCheckReport report =
        pipeline(gateway).check("The moon orbits the earth", null, SourceType.CLAIM);
    assertTrue(gateway.generateCalls().isEmpty());
    assertEquals(List.of("The moon orbits the earth"), gateway.verifiedClaims());
    assertEquals(0.9, report.overallConfidence(), 1e-9);
  }

  @Test
  @DisplayName("A failed verification counts as 0.5")
  void verificationFailure() {
    ScriptedModelGateway gateway =
        new ScriptedModelGateway()
            .thenReturn("[\"Claim one\"]")
            .verifyingWith(
                (claim, context) -> {
                  throw new GatewayException("rate limited");
                });

    FactCheckReport report = pipeline(gateway).check("Claim one.", null, SourceType.TEXT);

    assertEquals(0.5, report.overallConfidence());
    assertEquals(Verdict.UNCERTAIN, report.verdict());
    assertEquals("Verification failed: rate limited", report.results().get(0).reasoning());
  }

  @Test
  @DisplayName("Progress is reported for every stage on the way")
  void progress() {
    ScriptedModelGateway gateway = new ScriptedModelGateway().thenReturn("[\"A claim\"]");
    List<String> stages = new ArrayList<>();
    pipeline(gateway)
        .run(
            new FactCheckState("text", null, SourceType.TEXT),
            new PipelineContext(null, null, (stage, p, s) -> stages.add(stage + "@" + p)));
    assertEquals(
        List.of(
            "parse_claims@25.0", "search_sources@50.0", "verify_claims@75.0", "aggregate@100.0"),
        stages);
  }

  @Test
  @DisplayName("A cancelled check reports an unverifiable result")
  void cancelled() {
    ScriptedModelGateway gateway = new ScriptedModelGateway();
    FactCheckReport report =
        pipeline(gateway)
            .check("text", null, SourceType.TEXT, new PipelineContext(null, () -> true, null));
    assertEquals(0, gateway.callCount());
    assertEquals(Verdict.UNVERIFIABLE, report.verdict());
    assertEquals("Fact check was cancelled.", report.summary());
  }
}
