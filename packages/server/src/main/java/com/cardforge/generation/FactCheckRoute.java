package com.cardforge.generation;

/** Outgoing routes of the duplicate-check stage. */
public enum FactCheckRoute {
  FACT_CHECK,
  SKIP
}
