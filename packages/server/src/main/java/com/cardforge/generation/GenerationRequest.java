package com.cardforge.generation;

import com.cardforge.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of one card generation request.
 *
 * <p>Missing optional values are normalized by the canonical constructor (basic cards, medium
 * difficulty, English, no tags). Range checks live in {@link #validate()} so that stored records
 * can always be read back.
 */
public record GenerationRequest(
    String topic,
    String deckId,
    CardType cardType,
    int requestedCount,
    String language,
    Difficulty difficulty,
    String context,
    String modelId,
    boolean factCheck,
    boolean includeSources,
    List<String> tags) {

  public static final int MAX_TOPIC_LENGTH = 500;
  public static final int MAX_CARDS = 20;
  public static final int MAX_CONTEXT_LENGTH = 5000;
  public static final int MAX_TAGS = 20;

  public GenerationRequest {
    cardType = cardType == null ? CardType.BASIC : cardType;
    language = language == null ? "en" : language;
    difficulty = difficulty == null ? Difficulty.MEDIUM : difficulty;
    tags = tags == null ? List.of() : List.copyOf(tags);
  }

  public static Builder builder(String topic, String deckId) {
    return new Builder(topic, deckId);
  }

  /**
   * Check the documented bounds.
   *
   * @throws ValidationException naming the first offending field
   */
  public GenerationRequest validate() {
    if (topic == null || topic.isBlank()) {
      throw new ValidationException("topic must not be empty");
    }
    if (topic.length() > MAX_TOPIC_LENGTH) {
      throw new ValidationException("topic must be at most " + MAX_TOPIC_LENGTH + " characters");
    }
    if (deckId == null || deckId.isBlank()) {
      throw new ValidationException("deckId must not be empty");
    }
    if (requestedCount < 1 || requestedCount > MAX_CARDS) {
      throw new ValidationException("requestedCount must be between 1 and " + MAX_CARDS);
    }
    if (language.length() < 2 || language.length() > 5) {
      throw new ValidationException("language must be 2 to 5 characters");
    }
    if (context != null && context.length() > MAX_CONTEXT_LENGTH) {
      throw new ValidationException(
          "context must be at most " + MAX_CONTEXT_LENGTH + " characters");
    }
    if (tags.size() > MAX_TAGS) {
      throw new ValidationException("at most " + MAX_TAGS + " tags are allowed");
    }
    return this;
  }

  public boolean hasContext() {
    return context != null && !context.isBlank();
  }

  public static final class Builder {
    private final String topic;
    private final String deckId;
    private CardType cardType = CardType.BASIC;
    private int requestedCount = 5;
    private String language = "en";
    private Difficulty difficulty = Difficulty.MEDIUM;
    private String context;
    private String modelId;
    private boolean factCheck = true;
    private boolean includeSources = true;
    private final List<String> tags = new ArrayList<>();

    private Builder(String topic, String deckId) {
      this.topic = topic;
      this.deckId = deckId;
    }

    public Builder cardType(CardType cardType) {
      this.cardType = cardType;
      return this;
    }

    public Builder requestedCount(int requestedCount) {
      this.requestedCount = requestedCount;
      return this;
    }

    public Builder language(String language) {
      this.language = language;
      return this;
    }

    public Builder difficulty(Difficulty difficulty) {
      this.difficulty = difficulty;
      return this;
    }

    public Builder context(String context) {
      this.context = context;
      return this;
    }

    public Builder modelId(String modelId) {
      this.modelId = modelId;
      return this;
    }

    public Builder factCheck(boolean factCheck) {
      this.factCheck = factCheck;
      return this;
    }

    public Builder includeSources(boolean includeSources) {
      this.includeSources = includeSources;
      return this;
    }

    public Builder tags(List<String> tags) {
      this.tags.clear();
      if (tags != null) {
        this.tags.addAll(tags);
      }
      return this;
    }

    public GenerationRequest build() {
      return new GenerationRequest(
          topic,
          deckId,
          cardType,
          requestedCount,
          language,
          difficulty,
          context,
          modelId,
          factCheck,
          includeSources,
          tags);
    }
  }
}
