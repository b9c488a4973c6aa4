package com.cardforge.factcheck;

/** Reference material used when verifying claims. Reliability is in [0, 1]. */
public record Source(String type, String content, double reliability) {}
