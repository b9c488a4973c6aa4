package com.cardforge.generation;

import com.cardforge.factcheck.FactCheckPipeline;
import com.cardforge.factcheck.FactCheckReport;
import com.cardforge.model.ClaimVerification;
import com.cardforge.pipeline.PipelineContext;
import java.util.List;

/**
 * Verifies each card by running the full fact-check pipeline on its question/answer pair. The
 * card's confidence is the report's aggregated confidence.
 */
public final class FactCheckCardVerifier implements CardVerifier {
  private final FactCheckPipeline factCheckPipeline;

  public FactCheckCardVerifier(FactCheckPipeline factCheckPipeline) {
    this.factCheckPipeline = factCheckPipeline;
  }

  @Override
  public ClaimVerification verify(DraftCard card, String context, PipelineContext pipelineContext) {
    FactCheckReport report =
        factCheckPipeline.checkCard(card.front(), card.back(), context, pipelineContext.nested());
    List<String> sources =
        report.results().stream()
            .flatMap(r -> r.sources().stream())
            .distinct()
            .toList();
    return new ClaimVerification(report.overallConfidence(), sources, report.summary());
  }
}
