package com.cardforge.exception;

import java.time.Instant;
import java.util.Map;

/** Serializable summary of a failure, safe to return across the API boundary. */
public record ErrorDetails(
    String type,
    String message,
    CardForgeErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
