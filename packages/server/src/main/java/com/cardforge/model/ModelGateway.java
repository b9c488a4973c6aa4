package com.cardforge.model;

/**
 * Capability contract for the external language-model service.
 *
 * <p>Every call is a single request/response exchange. Retries, rate limiting and, above all, a
 * finite timeout are the gateway's responsibility: the pipelines only observe cancellation between
 * stages, so an unbounded gateway call would make cancellation unbounded too.
 *
 * <p>Failures are reported as {@link com.cardforge.exception.GatewayException}.
 */
public interface ModelGateway {

  /**
   * Run one text generation. When {@link CompletionRequest#responseSchema()} is present and the
   * provider supports structured output, the returned content conforms to that schema.
   */
  CompletionResponse generate(CompletionRequest request);

  /**
   * Ask the model how confident it is that {@code claim} is true.
   *
   * @param claim the assertion to verify
   * @param context optional supporting material, may be {@code null}
   */
  ClaimVerification verifyClaim(String claim, String context);

  /** Model used when a request does not name one. */
  String defaultModel();
}
