package com.cardforge.generation;

import com.cardforge.pipeline.StageId;

public enum CardGenerationStage implements StageId {
  FETCH_CONTEXT("fetch_context", 20.0),
  GENERATE("generate", 50.0),
  CHECK_DUPLICATES("check_duplicates", 65.0),
  FACT_CHECK("fact_check", 80.0),
  ROUTE("route", 90.0),
  SAVE("save", 100.0);

  private final String stageName;
  private final double progress;

  CardGenerationStage(String stageName, double progress) {
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
