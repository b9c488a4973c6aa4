package com.cardforge.factcheck;

import java.util.List;

/**
 * Offers the caller's context, when present, as the only source. Claims are otherwise verified
 * against the model's own knowledge.
 */
public final class ContextSourceRetriever implements SourceRetriever {
  public static final String PROVIDED_CONTEXT = "provided_context";
  public static final double PROVIDED_CONTEXT_RELIABILITY = 0.8;

  @Override
  public List<Source> retrieve(List<Claim> claims, String context) {
    if (context == null || context.isBlank()) {
      return List.of();
    }
    return List.of(new Source(PROVIDED_CONTEXT, context, PROVIDED_CONTEXT_RELIABILITY));
  }
}
