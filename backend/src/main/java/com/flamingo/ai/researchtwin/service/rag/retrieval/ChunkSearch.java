package com.flamingo.ai.researchtwin.service.rag.retrieval;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.service.rag.similarity.TextSimilarity;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Brute-force ranked search over the chunks held in a {@link RetrievalContext}.
 *
 * <p>A chunk scores by cosine similarity to the query embedding when both vectors exist, else by
 * keyword overlap. Redundant thesis chunks lose the configured penalty. Sorting is stable, so
 * equal scores keep store order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChunkSearch {

  private final RagConfig ragConfig;

  public List<RagChunk> search(RetrievalContext context, ChunkQuery query) {
    Set<String> names = new HashSet<>(query.documentNames());
    List<ScoredChunk> ranked = new ArrayList<>();
    for (RagChunk chunk : context.chunks()) {
      if (!query.roles().isEmpty() && !query.roles().contains(chunk.getSourceRole())) {
        continue;
      }
      if (!names.isEmpty() && !names.contains(chunk.getSourceName())) {
        continue;
      }
      if (query.excludeRedundant() && chunk.isRedundant()) {
        continue;
      }
      ranked.add(new ScoredChunk(chunk, score(context, chunk)));
    }
    if (ranked.isEmpty()) {
      return List.of();
    }
    ranked.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());

    List<RagChunk> ordered = ranked.stream().map(ScoredChunk::chunk).toList();
    List<RagChunk> selected =
        DiversityCap.cap(ordered, query.maxChunksPerDocument()).stream()
            .limit(Math.max(1, query.topK()))
            .toList();
    log.debug(
        "Search {} matched {} candidates, selected {}", query, ranked.size(), selected.size());
    return selected;
  }

  double score(RetrievalContext context, RagChunk chunk) {
    double score =
        !context.queryEmbedding().isEmpty() && chunk.hasEmbedding()
            ? TextSimilarity.cosine(context.queryEmbedding(), chunk.getEmbedding())
            : TextSimilarity.keywordScore(context.query(), chunk.getText());
    if (chunk.isRedundantThesis()) {
      score -= ragConfig.getDedup().getRedundantThesisPenalty();
    }
    return score;
  }

  private record ScoredChunk(RagChunk chunk, double score) {}
}
