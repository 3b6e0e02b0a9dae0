package com.flamingo.ai.researchtwin.service.rag.retrieval.strategy;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.service.rag.retrieval.ChunkQuery;
import com.flamingo.ai.researchtwin.service.rag.retrieval.ChunkSearch;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalContext;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalResult;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalStrategy;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Hard filter to the single mentioned publication. Its result is final even when empty: other
 * papers are never substituted for the one the query names.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class PaperSpecificStrategy implements RetrievalStrategy {

  private final ChunkSearch chunkSearch;
  private final RagConfig ragConfig;

  @Override
  public String name() {
    return "paper_specific";
  }

  @Override
  public boolean supports(RetrievalContext context) {
    return context.intent() == RetrievalIntent.PAPER_SPECIFIC && context.hasTargets();
  }

  @Override
  public Optional<RetrievalResult> retrieve(RetrievalContext context) {
    String target = context.targetDocumentNames().get(0);
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    int perDocument =
        Math.max(
            retrieval.getPaperSpecificMinPerDocument(),
            Math.min(retrieval.getPaperSpecificMaxPerDocument(), context.topK()));

    List<RagChunk> chunks =
        chunkSearch.search(
            context,
            ChunkQuery.publications(context.topK(), perDocument).toBuilder()
                .documentNames(List.of(target))
                .build());

    String note =
        chunks.isEmpty()
            ? "paper_specific hard filter had no results for " + target
            : "paper_specific hard filter applied: " + target;
    return Optional.of(context.result(chunks, List.of(target), note));
  }
}
