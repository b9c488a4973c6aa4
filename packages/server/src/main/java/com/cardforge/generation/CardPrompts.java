package com.cardforge.generation;

import com.cardforge.utility.JacksonUtility;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.stream.Collectors;

/** Prompt text and output schema for card generation. */
final class CardPrompts {
  private CardPrompts() {}

  static String systemPrompt(CardType cardType, Difficulty difficulty, String language) {
    return """
        You are an expert flashcard creator for Anki. \
        Your task is to create high-quality educational flashcards.

        CARD TYPE: %s
        %s

        DIFFICULTY: %s
        %s

        LANGUAGE: %s
        Create all content in %s.

        GUIDELINES:
        1. Each card should focus on ONE concept
        2. Questions should be clear and unambiguous
        3. Answers should be concise but complete
        4. Avoid yes/no questions
        5. Include context when needed
        6. Make cards that test understanding, not just recall

        OUTPUT FORMAT:
        Return cards as JSON array:
        ```json
        [
            {
                "front": "Question or prompt",
                "back": "Answer or response",
                "tags": ["tag1", "tag2"]
            }
        ]
        ```"""
        .formatted(
            cardType.value(),
            cardTypeInstruction(cardType),
            difficulty.value(),
            difficultyGuideline(difficulty),
            language,
            language);
  }

  static String userPrompt(
      String topic, int count, List<ContextItem> contextItems, List<String> tags) {
    StringBuilder prompt =
        new StringBuilder("Create ").append(count).append(" flashcards about: ").append(topic);
    if (contextItems != null && !contextItems.isEmpty()) {
      prompt
          .append("\n\nUSE THIS CONTEXT:\n")
          .append(
              contextItems.stream().map(ContextItem::content).collect(Collectors.joining("\n\n")));
    }
    if (tags != null && !tags.isEmpty()) {
      prompt.append("\n\nInclude these tags: ").append(String.join(", ", tags));
    }
    return prompt.toString();
  }

  /** JSON schema of the expected answer: an array of {front, back, tags} objects. */
  static JsonNode cardArraySchema() {
    ObjectNode schema = JacksonUtility.getJsonMapper().createObjectNode();
    schema.put("type", "array");
    ObjectNode item = schema.putObject("items");
    item.put("type", "object");
    ObjectNode properties = item.putObject("properties");
    properties.putObject("front").put("type", "string");
    properties.putObject("back").put("type", "string");
    properties.putObject("tags").put("type", "array").putObject("items").put("type", "string");
    item.putArray("required").add("front").add("back");
    return schema;
  }

  private static String cardTypeInstruction(CardType cardType) {
    return switch (cardType) {
      case BASIC -> "Create basic flashcards with a question on the front and answer on the back.";
      case CLOZE -> "Create cloze deletion cards where key terms are wrapped in {{c1::term}}.";
      case BASIC_REVERSED -> "Create cards that can be studied in both directions.";
    };
  }

  private static String difficultyGuideline(Difficulty difficulty) {
    return switch (difficulty) {
      case EASY -> "Focus on fundamental concepts. Use simple language and short answers.";
      case MEDIUM -> "Cover moderate complexity. Include some details but stay concise.";
      case HARD -> "Cover advanced topics. Include nuanced details and connections.";
    };
  }
}
