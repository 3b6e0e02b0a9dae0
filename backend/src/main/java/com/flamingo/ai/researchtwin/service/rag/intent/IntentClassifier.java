package com.flamingo.ai.researchtwin.service.rag.intent;

import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.model.DocumentMetadata;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import com.flamingo.ai.researchtwin.service.rag.similarity.TextKeys;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps a free-text query to a {@link RetrievalIntent} and the known documents it names.
 *
 * <p>A document is mentioned when one of its aliases (file-name stem, title, canonical citation)
 * appears in the query verbatim, or when enough of the alias tokens do. Intent rules are checked
 * in a fixed order and the first match wins.
 */
@Component
@Slf4j
public class IntentClassifier {

  static final List<String> FUTURE_TERMS =
      List.of(
          "future",
          "future directions",
          "open problem",
          "open problems",
          "next step",
          "next steps",
          "roadmap",
          "limitation",
          "limitations");

  static final List<String> OVERVIEW_TERMS =
      List.of(
          "overall",
          "big picture",
          "summary",
          "journey",
          "evolution",
          "problem definition",
          "research theme",
          "how your work evolved");

  static final List<String> COMPARE_TERMS =
      List.of(
          "compare",
          "comparison",
          "versus",
          "vs",
          "difference",
          "different",
          "better than",
          "tradeoff",
          "trade-off");

  static final List<String> PAPER_SIGNAL_TERMS =
      List.of(
          "paper",
          "publication",
          "wacv",
          "cvpr",
          "cvprw",
          "iccv",
          "iccvw",
          "eccv",
          "eccvw",
          "tmlr",
          "bmvc",
          "iclr",
          "result",
          "results",
          "ablation",
          "table",
          "metric",
          "accuracy",
          "miou",
          "f1",
          "auc",
          "dataset");

  private static final int VERBATIM_ALIAS_MIN_LENGTH = 6;
  private static final double VERBATIM_SCORE = 3.0;
  private static final double TOKEN_OVERLAP_BASE_SCORE = 2.0;
  private static final double TOKEN_OVERLAP_MIN_RATIO = 0.6;
  private static final double SINGLE_TOKEN_SCORE = 1.25;

  /**
   * Classifies a query against the namespace's visible documents.
   *
   * @param query the user query
   * @param documents documents known in the namespace
   * @return intent plus the documents the query mentions
   */
  public IntentClassification classify(String query, List<RagDocument> documents) {
    List<RagDocument> mentioned = findMentionedDocuments(query, documents);
    IntentClassification classification =
        new IntentClassification(detectIntent(query, mentioned), mentioned);
    log.debug(
        "Classified query as {} with {} mentioned documents ({} publications)",
        classification.intent().getValue(),
        mentioned.size(),
        classification.mentionedPublications().size());
    return classification;
  }

  /** Documents with a positive mention score, highest score first. */
  public List<RagDocument> findMentionedDocuments(String query, List<RagDocument> documents) {
    if (documents == null || documents.isEmpty()) {
      return List.of();
    }
    String queryText = TextKeys.matchText(query);
    Set<String> queryTokens = new HashSet<>(TextKeys.matchTokens(queryText));
    return documents.stream()
        .map(doc -> new Mention(doc, mentionScore(queryText, queryTokens, doc)))
        .filter(mention -> mention.score() > 0)
        .sorted(Comparator.comparingDouble(Mention::score).reversed())
        .map(Mention::document)
        .toList();
  }

  RetrievalIntent detectIntent(String query, List<RagDocument> mentionedDocuments) {
    String queryText = TextKeys.matchText(query);
    long publicationMentions =
        mentionedDocuments.stream()
            .filter(doc -> doc.getSourceRole() == SourceRole.PUBLICATION)
            .count();
    boolean paperSignals = publicationMentions > 0 || containsAny(queryText, PAPER_SIGNAL_TERMS);

    if ((containsAny(queryText, COMPARE_TERMS) && publicationMentions >= 1)
        || publicationMentions >= 2) {
      return RetrievalIntent.PAPER_COMPARE;
    }
    if (containsAny(queryText, FUTURE_TERMS)) {
      return RetrievalIntent.FUTURE_DIRECTIONS;
    }
    if (containsAny(queryText, OVERVIEW_TERMS)) {
      return RetrievalIntent.RESEARCH_OVERVIEW;
    }
    if (publicationMentions == 1 && paperSignals) {
      return RetrievalIntent.PAPER_SPECIFIC;
    }
    return RetrievalIntent.TECHNICAL_CROSS_PAPER;
  }

  static double mentionScore(String queryText, Set<String> queryTokens, RagDocument document) {
    double best = 0;
    for (String alias : aliases(document)) {
      if (alias.length() >= VERBATIM_ALIAS_MIN_LENGTH && queryText.contains(alias)) {
        best = Math.max(best, VERBATIM_SCORE);
        continue;
      }
      List<String> aliasTokens =
          TextKeys.matchTokens(alias).stream().filter(token -> token.length() > 2).toList();
      if (aliasTokens.isEmpty()) {
        continue;
      }
      long overlap = aliasTokens.stream().filter(queryTokens::contains).count();
      double ratio = (double) overlap / aliasTokens.size();
      if (aliasTokens.size() >= 2 && ratio >= TOKEN_OVERLAP_MIN_RATIO) {
        best = Math.max(best, TOKEN_OVERLAP_BASE_SCORE + ratio);
      } else if (aliasTokens.size() == 1 && ratio >= 1) {
        best = Math.max(best, SINGLE_TOKEN_SCORE);
      }
    }
    return best;
  }

  /** Normalized, non-empty aliases: file-name stem, title and canonical citation. */
  static Set<String> aliases(RagDocument document) {
    Set<String> aliases = new LinkedHashSet<>();
    if (document.getFileName() != null) {
      aliases.add(TextKeys.matchText(TextKeys.fileStem(document.getFileName())));
    }
    DocumentMetadata metadata = document.getMetadata();
    if (metadata != null) {
      aliases.add(TextKeys.matchText(metadata.getTitle()));
      aliases.add(TextKeys.matchText(metadata.getCanonicalCitation()));
    }
    aliases.remove("");
    return aliases;
  }

  private static boolean containsAny(String text, List<String> terms) {
    return terms.stream().anyMatch(text::contains);
  }

  private record Mention(RagDocument document, double score) {}
}
