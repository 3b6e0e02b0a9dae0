package com.flamingo.ai.researchtwin.service.chat;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchtwin.config.RagConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AgentResponseParser Tests")
class AgentResponseParserTest {

  private AgentResponseParser parser;

  @BeforeEach
  void setUp() {
    parser = new AgentResponseParser(new ObjectMapper(), new RagConfig());
  }

  @Nested
  @DisplayName("JSON completions")
  class JsonCompletions {

    @Test
    @DisplayName("Should read a fenced JSON object")
    void shouldReadFencedJson() {
      String completion =
          """
          ```json
          {"response_text": "I adapt BN statistics [P1].", "suggested_followups": ["Why BN?"]}
          ```""";

      ParsedAnswer parsed = parser.parse(completion);

      assertThat(parsed.responseText()).isEqualTo("I adapt BN statistics [P1].");
      assertThat(parsed.suggestedFollowups()).containsExactly("Why BN?");
    }

    @Test
    @DisplayName("Should find the JSON object inside prose and drop reasoning blocks")
    void shouldFindEmbeddedJson() {
      String completion =
          "<think>the user wants {a summary}</think>Sure, here it is: "
              + "{\"answer\": \"My thesis studies shift {briefly}.\"} Hope this helps.";

      ParsedAnswer parsed = parser.parse(completion);

      assertThat(parsed.responseText()).isEqualTo("My thesis studies shift {briefly}.");
      assertThat(parsed.suggestedFollowups()).isEmpty();
    }

    @Test
    @DisplayName("Should unwrap result and response nesting")
    void shouldUnwrapNestedPayload() {
      String completion =
          "{\"result\": {\"response\": {\"text\": \"Nested answer\","
              + " \"followups\": [\"Next?\"]}}}";

      ParsedAnswer parsed = parser.parse(completion);

      assertThat(parsed.responseText()).isEqualTo("Nested answer");
      assertThat(parsed.suggestedFollowups()).containsExactly("Next?");
    }

    @Test
    @DisplayName("Should cap follow-ups and skip blank ones")
    void shouldCapFollowups() {
      String completion =
          "{\"message\": \"ok\", \"next_questions\": [\"a\", \" \", \"b\", \"c\", \"d\", \"e\","
              + " \"f\"]}";

      ParsedAnswer parsed = parser.parse(completion);

      assertThat(parsed.suggestedFollowups()).containsExactly("a", "b", "c", "d", "e");
    }

    @Test
    @DisplayName("Should fall back to the JSON text when no answer field is present")
    void shouldUseJsonTextWithoutAnswerField() {
      ParsedAnswer parsed = parser.parse("{\"citations\": []}");

      assertThat(parsed.responseText()).isEqualTo("{\"citations\": []}");
    }
  }

  @Nested
  @DisplayName("Non-JSON completions")
  class PlainCompletions {

    @Test
    @DisplayName("Should use plain text as the answer")
    void shouldUsePlainText() {
      ParsedAnswer parsed = parser.parse("  My approach relies on entropy minimization.  ");

      assertThat(parsed.responseText()).isEqualTo("My approach relies on entropy minimization.");
      assertThat(parsed.suggestedFollowups()).isEmpty();
    }

    @Test
    @DisplayName("Should return a fixed message for empty completions")
    void shouldHandleEmptyCompletion() {
      assertThat(parser.parse(null).responseText()).isEqualTo(AgentResponseParser.NO_RESPONSE);
      assertThat(parser.parse("<think>only thinking</think>").responseText())
          .isEqualTo(AgentResponseParser.NO_RESPONSE);
    }
  }

  @Test
  @DisplayName("Should match braces outside of string literals")
  void shouldMatchBraces() {
    String text = "x {\"a\": \"}\\\"{\", \"b\": {}} y";

    assertThat(AgentResponseParser.matchingBrace(text, 2)).isEqualTo(text.length() - 3);
    assertThat(AgentResponseParser.matchingBrace("{\"open\": 1", 0)).isEqualTo(-1);
  }
}
