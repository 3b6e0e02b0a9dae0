package com.flamingo.ai.researchtwin.service.rag.retrieval.strategy;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.service.rag.retrieval.ChunkQuery;
import com.flamingo.ai.researchtwin.service.rag.retrieval.ChunkSearch;
import com.flamingo.ai.researchtwin.service.rag.retrieval.DiversityCap;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalContext;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalResult;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Seeds one best chunk from every compared publication so each is represented, then tops up from
 * the same publications. Declines when none of them yields a chunk.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class PaperCompareStrategy implements RetrievalStrategy {

  private final ChunkSearch chunkSearch;
  private final RagConfig ragConfig;

  @Override
  public String name() {
    return "paper_compare";
  }

  @Override
  public boolean supports(RetrievalContext context) {
    return context.intent() == RetrievalIntent.PAPER_COMPARE && context.hasTargets();
  }

  @Override
  public Optional<RetrievalResult> retrieve(RetrievalContext context) {
    int maxPerDocument = ragConfig.getDiversity().getMaxChunksPerDocument();
    List<String> targets = context.targetDocumentNames();

    List<RagChunk> candidates = new ArrayList<>();
    for (String target : targets) {
      List<RagChunk> seed =
          chunkSearch.search(
              context,
              ChunkQuery.publications(1, 1).toBuilder().documentNames(List.of(target)).build());
      candidates.addAll(seed);
    }
    candidates.addAll(
        chunkSearch.search(
            context,
            ChunkQuery.publications(context.topK(), maxPerDocument).toBuilder()
                .documentNames(targets)
                .build()));

    List<RagChunk> merged =
        DiversityCap.cap(DiversityCap.mergeUnique(candidates), maxPerDocument).stream()
            .limit(context.topK())
            .toList();
    if (merged.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        context.result(
            merged, targets, "paper_compare targeted papers: " + String.join(", ", targets)));
  }
}
