package com.cardforge.factcheck;

import com.cardforge.pipeline.PipelineState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Working state of one fact-check run. */
public final class FactCheckState extends PipelineState {
  private final String content;
  private final String context;
  private final SourceType sourceType;

  private List<Claim> claims = new ArrayList<>();
  private List<Source> sources = new ArrayList<>();
  private List<VerificationResult> results = new ArrayList<>();
  private ConfidenceAggregator.Result aggregate;

  public FactCheckState(String content, String context, SourceType sourceType) {
    this.content = content == null ? "" : content;
    this.context = context;
    this.sourceType = sourceType == null ? SourceType.TEXT : sourceType;
  }

  public String getContent() {
    return content;
  }

  public String getContext() {
    return context;
  }

  public SourceType getSourceType() {
    return sourceType;
  }

  public List<Claim> getClaims() {
    return Collections.unmodifiableList(claims);
  }

  void setClaims(List<Claim> claims) {
    this.claims = new ArrayList<>(claims);
  }

  public List<Source> getSources() {
    return Collections.unmodifiableList(sources);
  }

  void setSources(List<Source> sources) {
    this.sources = new ArrayList<>(sources);
  }

  public List<VerificationResult> getResults() {
    return Collections.unmodifiableList(results);
  }

  void setResults(List<VerificationResult> results) {
    this.results = new ArrayList<>(results);
  }

  /** The aggregated outcome, or {@code null} if the run stopped before the aggregate stage. */
  public ConfidenceAggregator.Result getAggregate() {
    return aggregate;
  }

  void setAggregate(ConfidenceAggregator.Result aggregate) {
    this.aggregate = aggregate;
  }
}
