package com.flamingo.ai.researchtwin.service.rag.similarity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TextSimilarity Tests")
class TextSimilarityTest {

  @Nested
  @DisplayName("cosine")
  class Cosine {

    @Test
    @DisplayName("Should return 1 for identical vectors")
    void shouldReturnOneForIdenticalVectors() {
      assertThat(TextSimilarity.cosine(List.of(0.3f, 0.4f), List.of(0.3f, 0.4f)))
          .isCloseTo(1.0, within(1e-6));
    }

    @Test
    @DisplayName("Should return 0 for orthogonal vectors")
    void shouldReturnZeroForOrthogonalVectors() {
      assertThat(TextSimilarity.cosine(List.of(1f, 0f), List.of(0f, 1f))).isZero();
    }

    @Test
    @DisplayName("Should return 0 for degenerate input")
    void shouldReturnZeroForDegenerateInput() {
      assertThat(TextSimilarity.cosine(null, List.of(1f))).isZero();
      assertThat(TextSimilarity.cosine(List.of(), List.of())).isZero();
      assertThat(TextSimilarity.cosine(List.of(1f, 0f), List.of(1f))).isZero();
      assertThat(TextSimilarity.cosine(List.of(0f, 0f), List.of(1f, 1f))).isZero();
    }
  }

  @Nested
  @DisplayName("lexical overlap")
  class LexicalOverlap {

    @Test
    @DisplayName("Should build one gram from short texts")
    void shouldBuildOneGramFromShortTexts() {
      assertThat(TextSimilarity.wordShingles("A short text here"))
          .containsExactly("short text here");
    }

    @Test
    @DisplayName("Should build sliding five-word grams")
    void shouldBuildSlidingFiveWordGrams() {
      assertThat(TextSimilarity.wordShingles("one two three four five six"))
          .containsExactlyInAnyOrder("one two three four five", "two three four five six");
    }

    @Test
    @DisplayName("Should score identical texts as full overlap")
    void shouldScoreIdenticalTextsAsFullOverlap() {
      String text = "Test time adaptation updates batch norm statistics online.";
      assertThat(TextSimilarity.lexicalOverlap(text, text.toUpperCase())).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should score empty text as zero")
    void shouldScoreEmptyTextAsZero() {
      assertThat(TextSimilarity.lexicalOverlap("", "anything at all here")).isZero();
      assertThat(TextSimilarity.lexicalOverlap(null, null)).isZero();
    }

    @Test
    @DisplayName("Should score extended sentence below the default lexical threshold")
    void shouldScoreExtendedSentenceBelowThreshold() {
      double overlap =
          TextSimilarity.lexicalOverlap(
              "We achieve 92% mIoU on CamVid.",
              "We achieve 92% mIoU on CamVid, extending this with a discussion of failure"
                  + " cases.");
      assertThat(overlap).isGreaterThan(0).isLessThan(0.85);
    }
  }

  @Nested
  @DisplayName("novel sentence ratio")
  class NovelSentenceRatio {

    @Test
    @DisplayName("Should count one new sentence out of two as half novel")
    void shouldCountHalfNovel() {
      String publication = "We achieve 92% mIoU on the CamVid benchmark.";
      String thesis =
          "We achieve 92% mIoU on the CamVid benchmark. We also discuss typical failure cases.";

      assertThat(TextSimilarity.novelSentenceRatio(thesis, publication)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Should ignore sentences shorter than the minimum length")
    void shouldIgnoreShortSentences() {
      String publication = "Our method adapts normalization layers at test time.";
      String thesis = "Our method adapts normalization layers at test time. See above.";

      assertThat(TextSimilarity.novelSentenceRatio(thesis, publication)).isZero();
    }

    @Test
    @DisplayName("Should return 0 when the thesis has no qualifying sentence")
    void shouldReturnZeroWithoutSentences() {
      assertThat(TextSimilarity.novelSentenceRatio("Too short.", "Anything")).isZero();
    }

    @Test
    @DisplayName("Should normalize punctuation and whitespace before comparing")
    void shouldNormalizeBeforeComparing() {
      assertThat(TextSimilarity.normalizeSentence("  Hello,   World!  2024 "))
          .isEqualTo("hello world 2024");
    }
  }

  @Test
  @DisplayName("Should score keyword hits relative to candidate length")
  void shouldScoreKeywordHits() {
    assertThat(TextSimilarity.keywordScore("domain shift", "simple signal for domain shift"))
        .isEqualTo(0.4);
    assertThat(TextSimilarity.keywordScore("", "anything")).isZero();
    assertThat(TextSimilarity.keywordScore("query", null)).isZero();
  }

  @Test
  @DisplayName("Should count edge punctuation pieces in the candidate length")
  void shouldCountEdgePiecesInKeywordDenominator() {
    assertThat(TextSimilarity.keywordScore("domain shift", "Domain shift."))
        .isCloseTo(2.0 / 3, within(1e-9));
    assertThat(TextSimilarity.keywordScore("domain", "(domain)")).isCloseTo(1.0 / 3, within(1e-9));
    assertThat(TextSimilarity.keywordScore("domain", "")).isZero();
  }
}
