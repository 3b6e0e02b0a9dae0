package com.flamingo.ai.researchtwin.service.rag.retrieval.strategy;

import com.flamingo.ai.researchtwin.config.RagConfig;
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

/** Last rung: ranks every chunk regardless of role or redundancy. Always produces a result. */
@Component
@Order(100)
@RequiredArgsConstructor
public class UnfilteredStrategy implements RetrievalStrategy {

  private final ChunkSearch chunkSearch;
  private final RagConfig ragConfig;

  @Override
  public String name() {
    return "unfiltered";
  }

  @Override
  public Optional<RetrievalResult> retrieve(RetrievalContext context) {
    List<RagChunk> chunks =
        chunkSearch.search(
            context,
            ChunkQuery.builder()
                .topK(context.topK())
                .maxChunksPerDocument(ragConfig.getDiversity().getMaxChunksPerDocument())
                .build());
    return Optional.of(
        context.result(
            chunks,
            context.targetDocumentNames(),
            "intent=" + context.intent().getValue() + " fallback=unfiltered"));
  }
}
