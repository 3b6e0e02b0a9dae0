package com.flamingo.ai.researchtwin.service.chat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchtwin.config.RagConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Extracts the answer from a model completion.
 *
 * <p>The completion should be a JSON object, but models wrap it in code fences, prefix it with
 * prose or reasoning blocks, nest it under {@code result}, or skip JSON entirely. Whatever cannot
 * be parsed is used as the answer text verbatim.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentResponseParser {

  static final String NO_RESPONSE = "I could not generate a response.";

  private static final List<String> TEXT_FIELDS =
      List.of("response_text", "text", "message", "answer", "error");
  private static final List<String> FOLLOWUP_FIELDS =
      List.of(
          "suggested_followups",
          "followups",
          "suggested_questions",
          "suggested_follow_up_questions",
          "next_questions");

  private static final Pattern THINK_BLOCK =
      Pattern.compile("(?is)<think>.*?</think>|^\\s*</think>\\s*");
  private static final Pattern CODE_FENCE = Pattern.compile("(?is)^```(?:json)?\\s*(.*?)\\s*```$");

  private final ObjectMapper objectMapper;
  private final RagConfig ragConfig;

  /**
   * Parses a raw completion.
   *
   * @param completion the model output
   * @return the answer text, never blank, and at most the configured number of follow-ups
   */
  public ParsedAnswer parse(String completion) {
    String cleaned = clean(completion);
    if (cleaned.isEmpty()) {
      return new ParsedAnswer(NO_RESPONSE, List.of());
    }

    Optional<JsonNode> payload = readPayload(cleaned);
    if (payload.isEmpty()) {
      log.debug("Completion is not JSON, using raw text ({} chars)", cleaned.length());
      return new ParsedAnswer(cleaned, List.of());
    }

    JsonNode source = unwrap(payload.get());
    String text = firstText(source).orElse(cleaned);
    return new ParsedAnswer(text, followups(source));
  }

  static String clean(String completion) {
    if (completion == null) {
      return "";
    }
    String text = THINK_BLOCK.matcher(completion).replaceAll("").trim();
    Matcher fence = CODE_FENCE.matcher(text);
    return fence.matches() ? fence.group(1).trim() : text;
  }

  private Optional<JsonNode> readPayload(String text) {
    Optional<JsonNode> whole = readObject(text);
    if (whole.isPresent()) {
      return whole;
    }
    int start = text.indexOf('{');
    while (start >= 0) {
      int end = matchingBrace(text, start);
      if (end < 0) {
        break;
      }
      Optional<JsonNode> candidate = readObject(text.substring(start, end + 1));
      if (candidate.isPresent()) {
        return candidate;
      }
      start = text.indexOf('{', start + 1);
    }
    return Optional.empty();
  }

  private Optional<JsonNode> readObject(String text) {
    try {
      JsonNode node = objectMapper.readTree(text);
      return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
    } catch (JsonProcessingException e) {
      log.trace("Not a JSON object: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  /** Index of the brace closing the object opened at {@code start}, or -1. */
  static int matchingBrace(String text, int start) {
    int depth = 0;
    boolean inString = false;
    boolean escaped = false;
    for (int i = start; i < text.length(); i++) {
      char ch = text.charAt(i);
      if (escaped) {
        escaped = false;
      } else if (ch == '\\') {
        escaped = true;
      } else if (ch == '"') {
        inString = !inString;
      } else if (!inString && ch == '{') {
        depth++;
      } else if (!inString && ch == '}') {
        depth--;
        if (depth == 0) {
          return i;
        }
      }
    }
    return -1;
  }

  private static JsonNode unwrap(JsonNode node) {
    JsonNode current = node;
    for (int depth = 0; depth < 4; depth++) {
      JsonNode nested = current.has("result") ? current.get("result") : current.get("response");
      if (nested == null || !nested.isObject()) {
        break;
      }
      current = nested;
    }
    return current;
  }

  private static Optional<String> firstText(JsonNode source) {
    for (String field : TEXT_FIELDS) {
      JsonNode value = source.get(field);
      if (value != null && value.isTextual() && !value.asText().isBlank()) {
        return Optional.of(value.asText().trim());
      }
    }
    return Optional.empty();
  }

  private List<String> followups(JsonNode source) {
    int max = ragConfig.getAgent().getMaxFollowups();
    for (String field : FOLLOWUP_FIELDS) {
      JsonNode value = source.get(field);
      if (value == null || !value.isArray()) {
        continue;
      }
      List<String> followups = new ArrayList<>();
      for (JsonNode item : value) {
        String question = item.asText("").trim();
        if (!question.isEmpty() && followups.size() < max) {
          followups.add(question);
        }
      }
      return followups;
    }
    return List.of();
  }
}
