package com.cardforge.factcheck;

import com.cardforge.pipeline.StageId;

public enum FactCheckStage implements StageId {
  PARSE_CLAIMS("parse_claims", 25.0),
  SEARCH_SOURCES("search_sources", 50.0),
  VERIFY_CLAIMS("verify_claims", 75.0),
  AGGREGATE("aggregate", 100.0);

  private final String stageName;
  private final double progress;

  FactCheckStage(String stageName, double progress) {
    this.stageName = stageName;
    this.progress = progress;
  }

  @Override
  public String stageName() {
    return stageName;
  }

  @Override
  public double progress() {
    return progress;
  }
}
