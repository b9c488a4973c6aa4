package com.cardforge.generation;

import com.cardforge.model.ClaimVerification;
import com.cardforge.model.ModelGateway;
import com.cardforge.pipeline.PipelineContext;

/** Verifies each card with a single {@link ModelGateway#verifyClaim} call. */
public final class DirectCardVerifier implements CardVerifier {
  private final ModelGateway gateway;

  public DirectCardVerifier(ModelGateway gateway) {
    this.gateway = gateway;
  }

  @Override
  public ClaimVerification verify(DraftCard card, String context, PipelineContext pipelineContext) {
    return gateway.verifyClaim(card.asClaim(), context);
  }
}
