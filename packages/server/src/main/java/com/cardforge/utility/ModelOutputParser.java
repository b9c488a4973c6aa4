package com.cardforge.utility;

import com.cardforge.logging.LoggingService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;

/**
 * Best-effort extraction of JSON payloads from free-text model output.
 *
 * <p>Gateways are asked for schema-constrained output first; this parser is the fallback for
 * providers that ignore the schema or wrap the answer in prose. Precedence:
 *
 * <ol>
 *   <li>the body of the first fenced code block ({@code ```json ... ```} or {@code ``` ... ```});
 *   <li>otherwise the first balanced top-level {@code [...]} (or {@code {...}}) span, ignoring
 *       brackets inside string literals.
 * </ol>
 *
 * <p>Nothing here throws on malformed input: failures are reported as empty results.
 */
public final class ModelOutputParser {
  private static final Logger log = LoggingService.getLogger(ModelOutputParser.class);

  private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

  private ModelOutputParser() {}

  /**
   * Parse a JSON array out of {@code content}. A single JSON object is treated as a one-element
   * array.
   *
   * @return the array elements, or an empty list when no JSON could be recovered
   */
  public static List<JsonNode> parseArray(String content) {
    Optional<String> candidate = locate(content, '[', ']');
    if (candidate.isEmpty()) {
      log.warn("No JSON array found in model output");
      return List.of();
    }
    JsonNode node;
    try {
      node = JacksonUtility.getJsonMapper().readTree(candidate.get());
    } catch (JsonProcessingException e) {
      log.warn("Model output is not valid JSON: {}", e.getOriginalMessage());
      return List.of();
    }
    if (node == null || node.isMissingNode() || node.isNull()) {
      return List.of();
    }
    if (!node.isArray()) {
      return List.of(node);
    }
    List<JsonNode> elements = new ArrayList<>(node.size());
    node.forEach(elements::add);
    return elements;
  }

  /**
   * Parse a JSON object out of {@code content}. The whole text is tried first, since structured
   * output usually returns a bare object.
   */
  public static Optional<JsonNode> parseObject(String content) {
    if (content == null || content.isBlank()) {
      return Optional.empty();
    }
    Optional<JsonNode> direct = tryRead(content.trim());
    if (direct.isPresent() && direct.get().isObject()) {
      return direct;
    }
    return locate(content, '{', '}').flatMap(ModelOutputParser::tryRead).filter(JsonNode::isObject);
  }

  /** Locate the JSON text following the documented precedence, without parsing it. */
  static Optional<String> locate(String content, char open, char close) {
    if (content == null || content.isBlank()) {
      return Optional.empty();
    }
    Matcher fenced = FENCED_BLOCK.matcher(content);
    if (fenced.find()) {
      String body = fenced.group(1).trim();
      if (!body.isEmpty()) {
        return Optional.of(body);
      }
    }
    return balancedSpan(content, open, close);
  }

  /** First balanced span starting at the first {@code open} character, string-literal aware. */
  static Optional<String> balancedSpan(String content, char open, char close) {
    int start = content.indexOf(open);
    if (start < 0) {
      return Optional.empty();
    }
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < content.length(); i++) {
      char c = content.charAt(i);
      if (inString) {
        if (escaped) {
          escaped = false;
        } else if (c == '\\') {
          escaped = true;
        } else if (c == '"') {
          inString = false;
        }
        continue;
      }
      if (c == '"') {
        inString = true;
      } else if (c == open) {
        depth++;
      } else if (c == close) {
        depth--;
        if (depth == 0) {
          return Optional.of(content.substring(start, i + 1));
        }
      }
    }
    return Optional.empty();
  }

  private static Optional<JsonNode> tryRead(String text) {
    try {
      return Optional.ofNullable(JacksonUtility.getJsonMapper().readTree(text));
    } catch (JsonProcessingException e) {
      return Optional.empty();
    }
  }
}
