package com.cardforge.jobs;

import com.cardforge.generation.GeneratedCard;

/**
 * One event of a generation stream. Fields that do not apply to the event type are {@code null}.
 */
public record GenerationEvent(
    GenerationEventType type,
    Double progress,
    String step,
    String message,
    GeneratedCard card,
    String error) {

  public static GenerationEvent progress(String step, double progress, String message) {
    return new GenerationEvent(GenerationEventType.PROGRESS, progress, step, message, null, null);
  }

  public static GenerationEvent card(GeneratedCard card, double progress) {
    return new GenerationEvent(GenerationEventType.CARD, progress, null, null, card, null);
  }

  public static GenerationEvent complete(String message) {
    return new GenerationEvent(GenerationEventType.COMPLETE, 100.0, null, message, null, null);
  }

  public static GenerationEvent error(String error) {
    return new GenerationEvent(GenerationEventType.ERROR, null, null, null, null, error);
  }
}
