package com.cardforge.factcheck;

import java.util.List;

/** Finds reference material for a set of claims. */
public interface SourceRetriever {
  List<Source> retrieve(List<Claim> claims, String context);
}
