package com.cardforge.utility;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ModelOutputParserTest {

  @Test
  @DisplayName("Fenced code block wins over surrounding prose")
  void fencedBlock() {
    String content =
        """
        Here are your cards [draft]:
        ```json
        [{"front": "Q1", "back": "A1"}, {"front": "Q2", "back": "A2"}]
        ```
        Let me know if you need more.""";
    List<JsonNode> nodes = ModelOutputParser.parseArray(content);
    assertEquals(2, nodes.size());
    assertEquals("Q2", nodes.get(1).get("front").asText());
  }

  @Test
  @DisplayName("Bare array embedded in text is found, brackets inside strings are ignored")
  void balancedSpanInText() {
    String content = "Sure! [{\"front\": \"What is a[0]?\", \"back\": \"The ] first\"}] Done.";
    List<JsonNode> nodes = ModelOutputParser.parseArray(content);
    assertEquals(1, nodes.size());
    assertEquals("The ] first", nodes.get(0).get("back").asText());
  }

  @Test
  @DisplayName("Unparseable output yields no elements and does not throw")
  void garbage() {
    assertTrue(ModelOutputParser.parseArray("not json").isEmpty());
    assertTrue(ModelOutputParser.parseArray("[1, 2").isEmpty());
    assertTrue(ModelOutputParser.parseArray(null).isEmpty());
    assertTrue(ModelOutputParser.parseArray("```json\n{broken\n```").isEmpty());
  }

  @Test
  @DisplayName("A single object is treated as a one-element array")
  void singleObject() {
    List<JsonNode> nodes = ModelOutputParser.parseArray("```\n{\"front\": \"Q\"}\n```");
    assertEquals(1, nodes.size());
    assertTrue(nodes.get(0).isObject());
  }

  @Test
  @DisplayName("Objects are parsed directly or recovered from prose")
  void parseObject() {
    Optional<JsonNode> direct = ModelOutputParser.parseObject("{\"confidence\": 0.9}");
    assertEquals(0.9, direct.orElseThrow().get("confidence").asDouble());

    Optional<JsonNode> embedded =
        ModelOutputParser.parseObject("My answer: {\"confidence\": 0.4, \"reasoning\": \"x}\"}.");
    assertEquals("x}", embedded.orElseThrow().get("reasoning").asText());

    assertTrue(ModelOutputParser.parseObject("no object here").isEmpty());
    assertTrue(ModelOutputParser.parseObject("[1, 2]").isEmpty());
  }
}
