package com.flamingo.ai.researchtwin.service.rag.similarity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure text and vector similarity functions shared by redundancy detection and ranking. None of
 * these methods throw on odd input; degenerate inputs score 0.
 */
public final class TextSimilarity {

  /** Width of the word n-grams used for lexical overlap. */
  public static final int SHINGLE_SIZE = 5;

  /** Normalized sentences shorter than this do not count towards novelty. */
  public static final int MIN_SENTENCE_LENGTH = 20;

  private static final Pattern NON_WORD = Pattern.compile("\\W+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NON_ALPHANUMERIC_OR_SPACE = Pattern.compile("[^a-z0-9 ]");
  private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!?]\\s+|\\n+");

  private TextSimilarity() {}

  /**
   * Cosine similarity of two vectors. Returns 0 for null, empty, mismatched-length or zero-norm
   * input.
   */
  public static double cosine(List<Float> a, List<Float> b) {
    if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
      return 0;
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.size(); i++) {
      double av = a.get(i) == null ? 0 : a.get(i);
      double bv = b.get(i) == null ? 0 : b.get(i);
      dot += av * bv;
      normA += av * av;
      normB += bv * bv;
    }
    if (normA == 0 || normB == 0) {
      return 0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  /**
   * Builds the set of contiguous word 5-grams. Tokens are split on non-word characters and
   * single-character tokens are dropped; a text with fewer than five tokens yields one gram made
   * of all of them.
   */
  public static Set<String> wordShingles(String text) {
    List<String> terms = new ArrayList<>();
    if (text != null) {
      for (String term : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
        if (term.length() > 1) {
          terms.add(term);
        }
      }
    }
    if (terms.size() < SHINGLE_SIZE) {
      return terms.isEmpty() ? Set.of() : Set.of(String.join(" ", terms));
    }
    Set<String> grams = new HashSet<>();
    for (int i = 0; i <= terms.size() - SHINGLE_SIZE; i++) {
      grams.add(String.join(" ", terms.subList(i, i + SHINGLE_SIZE)));
    }
    return grams;
  }

  public static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() || b.isEmpty()) {
      return 0;
    }
    int intersection = 0;
    for (String item : a) {
      if (b.contains(item)) {
        intersection++;
      }
    }
    int union = a.size() + b.size() - intersection;
    return union == 0 ? 0 : (double) intersection / union;
  }

  /** Word 5-gram Jaccard overlap of two texts. */
  public static double lexicalOverlap(String a, String b) {
    return jaccard(wordShingles(a), wordShingles(b));
  }

  /** Lower-cases, collapses whitespace and keeps only ASCII letters, digits and spaces. */
  public static String normalizeSentence(String sentence) {
    String collapsed = WHITESPACE.matcher(sentence.toLowerCase(Locale.ROOT)).replaceAll(" ");
    return NON_ALPHANUMERIC_OR_SPACE.matcher(collapsed).replaceAll("").trim();
  }

  /** Splits on sentence punctuation or newlines and keeps normalized sentences of useful length. */
  public static List<String> sentences(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    return Arrays.stream(SENTENCE_BREAK.split(text))
        .map(TextSimilarity::normalizeSentence)
        .filter(sentence -> sentence.length() >= MIN_SENTENCE_LENGTH)
        .toList();
  }

  /**
   * Fraction of thesis sentences that do not appear verbatim (after normalization) among the
   * publication sentences. Returns 0 when the thesis text has no qualifying sentence.
   */
  public static double novelSentenceRatio(String thesisText, String publicationText) {
    List<String> thesisSentences = sentences(thesisText);
    if (thesisSentences.isEmpty()) {
      return 0;
    }
    Set<String> publicationSentences = new LinkedHashSet<>(sentences(publicationText));
    long novel = thesisSentences.stream().filter(s -> !publicationSentences.contains(s)).count();
    return (double) novel / thesisSentences.size();
  }

  /**
   * Fraction of candidate tokens that also occur in the query. The empty pieces left by leading
   * or trailing punctuation count towards the candidate length. Used for ranking when either side
   * lacks an embedding.
   */
  public static double keywordScore(String query, String candidate) {
    Set<String> queryTerms = new HashSet<>();
    for (String term : NON_WORD.split(query == null ? "" : query.toLowerCase(Locale.ROOT))) {
      if (!term.isEmpty()) {
        queryTerms.add(term);
      }
    }
    if (queryTerms.isEmpty() || candidate == null) {
      return 0;
    }
    String[] candidateTerms = NON_WORD.split(candidate.toLowerCase(Locale.ROOT), -1);
    int hits = 0;
    for (String term : candidateTerms) {
      if (queryTerms.contains(term)) {
        hits++;
      }
    }
    return (double) hits / Math.max(candidateTerms.length, 1);
  }
}
