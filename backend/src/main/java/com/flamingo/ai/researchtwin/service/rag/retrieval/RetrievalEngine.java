package com.flamingo.ai.researchtwin.service.rag.retrieval;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.model.CorpusSnapshot;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import com.flamingo.ai.researchtwin.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.researchtwin.service.rag.intent.IntentClassification;
import com.flamingo.ai.researchtwin.service.rag.intent.IntentClassifier;
import com.flamingo.ai.researchtwin.store.CorpusStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Intent-aware chunk retrieval.
 *
 * <p>The namespace snapshot is read and the query embedded once per request. The registered
 * {@link RetrievalStrategy} beans are then tried in order (paper-specific hard filter, paper
 * comparison, role mix with backfill, unfiltered) until one produces a result. Returned chunk
 * lists never exceed {@code topK}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalEngine {

  private final CorpusStore corpusStore;
  private final EmbeddingService embeddingService;
  private final IntentClassifier intentClassifier;
  private final List<RetrievalStrategy> strategies;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Retrieves evidence for an already classified query.
   *
   * @param namespaceId the corpus namespace
   * @param query the user query
   * @param intent the retrieval intent
   * @param mentionedDocuments documents the query mentions, strongest first; publications among
   *     them become the retrieval targets
   * @param topK maximum number of chunks; non-positive uses the configured default
   * @return ranked chunks with retrieval notes
   */
  @Timed(value = "rag.retrieval", description = "Time to retrieve evidence chunks")
  public RetrievalResult retrieve(
      String namespaceId,
      String query,
      RetrievalIntent intent,
      List<RagDocument> mentionedDocuments,
      int topK) {
    CorpusSnapshot snapshot = corpusStore.read(namespaceId);
    return retrieve(namespaceId, query, intent, mentionedDocuments, topK, snapshot);
  }

  /**
   * Classifies the query against the namespace's documents, then retrieves.
   *
   * @param namespaceId the corpus namespace
   * @param query the user query
   * @param topK maximum number of chunks; non-positive uses the configured default
   * @return ranked chunks with retrieval notes
   */
  @Timed(value = "rag.retrieval", description = "Time to retrieve evidence chunks")
  public RetrievalResult retrieveForQuery(String namespaceId, String query, int topK) {
    return retrieveForQuery(namespaceId, query, topK, corpusStore.read(namespaceId));
  }

  /**
   * Classifies and retrieves against a snapshot the caller has already read, so documents and
   * chunks come from the same store state.
   *
   * @param namespaceId the corpus namespace
   * @param query the user query
   * @param topK maximum number of chunks; non-positive uses the configured default
   * @param snapshot the namespace's corpus
   * @return ranked chunks with retrieval notes
   */
  @Timed(value = "rag.retrieval", description = "Time to retrieve evidence chunks")
  public RetrievalResult retrieveForQuery(
      String namespaceId, String query, int topK, CorpusSnapshot snapshot) {
    IntentClassification classification =
        intentClassifier.classify(query, snapshot.visibleDocuments());
    return retrieve(
        namespaceId,
        query,
        classification.intent(),
        classification.mentionedDocuments(),
        topK,
        snapshot);
  }

  private RetrievalResult retrieve(
      String namespaceId,
      String query,
      RetrievalIntent intent,
      List<RagDocument> mentionedDocuments,
      int topK,
      CorpusSnapshot snapshot) {
    int boundedTopK = Math.max(1, topK > 0 ? topK : ragConfig.getRetrieval().getDefaultTopK());
    List<RagDocument> mentioned = mentionedDocuments == null ? List.of() : mentionedDocuments;
    List<String> targets =
        mentioned.stream()
            .filter(doc -> doc.getSourceRole() == SourceRole.PUBLICATION)
            .limit(Math.max(1, ragConfig.getRetrieval().getMaxCompareTargets()))
            .map(RagDocument::getFileName)
            .toList();

    List<Float> queryEmbedding =
        snapshot.chunks().isEmpty() ? List.of() : embeddingService.embedQuery(query);
    if (queryEmbedding.isEmpty() && !snapshot.chunks().isEmpty()) {
      log.warn("Query embedding unavailable for namespace {}, ranking by keywords", namespaceId);
    }

    RetrievalContext context =
        new RetrievalContext(
            namespaceId,
            query,
            intent,
            mentioned,
            targets,
            boundedTopK,
            snapshot.visibleDocuments(),
            snapshot.chunks(),
            queryEmbedding);

    boolean declined = false;
    for (RetrievalStrategy strategy : strategies) {
      if (!strategy.supports(context)) {
        continue;
      }
      Optional<RetrievalResult> result = strategy.retrieve(context);
      if (result.isEmpty()) {
        log.debug("Strategy {} found nothing for namespace {}", strategy.name(), namespaceId);
        declined = true;
        continue;
      }
      if (declined) {
        meterRegistry.counter("rag.retrieval.fallback", "rung", strategy.name()).increment();
      }
      RetrievalResult retrieved = result.get();
      log.info(
          "Retrieved {} chunks for namespace {} via {} (intent={}, topK={}, diversity={})",
          retrieved.chunks().size(),
          namespaceId,
          strategy.name(),
          intent.getValue(),
          boundedTopK,
          String.format("%.2f", DiversityCap.diversityScore(retrieved.chunks())));
      return retrieved;
    }

    // only reachable when no terminal strategy is registered
    return new RetrievalResult(intent, List.of(), mentioned, targets, List.of());
  }
}
