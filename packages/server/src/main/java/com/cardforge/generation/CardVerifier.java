package com.cardforge.generation;

import com.cardforge.model.ClaimVerification;
import com.cardforge.pipeline.PipelineContext;

/** Strategy used by the fact-check stage to judge one card. */
public interface CardVerifier {

  /**
   * @param card the card to verify
   * @param context caller-supplied grounding material, may be {@code null}
   * @param pipelineContext context of the enclosing run
   * @throws com.cardforge.exception.GatewayException when the model service fails
   */
  ClaimVerification verify(DraftCard card, String context, PipelineContext pipelineContext);
}
