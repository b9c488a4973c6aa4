package com.cardforge.factcheck;

/** Outgoing routes of the claim extraction stage. */
public enum ClaimsRoute {
  CONTINUE,
  SKIP
}
