package com.flamingo.ai.researchtwin.service.rag.retrieval.strategy;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
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
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Splits the evidence budget between publication and thesis chunks by the intent's share,
 * interleaves the two ranked lists and backfills from both roles when short.
 */
@Component
@Order(30)
@RequiredArgsConstructor
@Slf4j
public class MixedRoleStrategy implements RetrievalStrategy {

  private final ChunkSearch chunkSearch;
  private final RagConfig ragConfig;

  @Override
  public String name() {
    return "mixed";
  }

  @Override
  public Optional<RetrievalResult> retrieve(RetrievalContext context) {
    RetrievalIntent intent = context.intent();
    int topK = context.topK();
    int maxPerDocument = ragConfig.getDiversity().getMaxChunksPerDocument();
    RoleSplit split = split(context);

    List<RagChunk> publicationChunks = List.of();
    if (split.publication() > 0) {
      ChunkQuery.ChunkQueryBuilder query =
          ChunkQuery.publications(split.publication(), maxPerDocument).toBuilder();
      if (intent == RetrievalIntent.PAPER_COMPARE && context.hasTargets()) {
        query.documentNames(context.targetDocumentNames());
      }
      publicationChunks = chunkSearch.search(context, query.build());
    }

    List<RagChunk> thesisChunks = List.of();
    if (split.thesis() > 0) {
      thesisChunks =
          chunkSearch.search(
              context,
              ChunkQuery.builder()
                  .topK(split.thesis())
                  .roles(Set.of(SourceRole.THESIS))
                  .excludeRedundant(!intent.isThesisLed())
                  .maxChunksPerDocument(maxPerDocument)
                  .build());
    }

    List<RagChunk> combined =
        intent.isThesisLed()
            ? DiversityCap.interleave(thesisChunks, publicationChunks, topK)
            : DiversityCap.interleave(publicationChunks, thesisChunks, topK);
    combined = DiversityCap.cap(DiversityCap.mergeUnique(combined), maxPerDocument);

    if (combined.size() < topK) {
      List<RagChunk> backfill =
          chunkSearch.search(
              context,
              ChunkQuery.builder()
                  .topK(topK * 2)
                  .roles(Set.of(SourceRole.PUBLICATION, SourceRole.THESIS))
                  .excludeRedundant(false)
                  .maxChunksPerDocument(maxPerDocument)
                  .build());
      List<RagChunk> merged = new ArrayList<>(combined);
      merged.addAll(backfill);
      combined = DiversityCap.cap(DiversityCap.mergeUnique(merged), maxPerDocument);
      log.debug("Backfilled mixed retrieval with {} candidates", backfill.size());
    }

    List<RagChunk> selected = combined.stream().limit(topK).toList();
    if (selected.isEmpty()) {
      return Optional.empty();
    }
    String note =
        String.format(
            "intent=%s mix publication=%d thesis=%d topK=%d",
            intent.getValue(), split.publication(), split.thesis(), topK);
    return Optional.of(context.result(selected, context.targetDocumentNames(), note));
  }

  /**
   * Per-role targets. Publication share is rounded half up; the remainder goes to thesis. Intents
   * that mix roles always keep at least one publication slot when publications exist.
   */
  static RoleSplit split(RetrievalContext context) {
    int topK = context.topK();
    RetrievalIntent intent = context.intent();
    boolean hasPublications = context.hasDocumentsWithRole(SourceRole.PUBLICATION);
    boolean hasThesis = context.hasDocumentsWithRole(SourceRole.THESIS);

    int publication =
        hasPublications ? (int) Math.round(topK * intent.getPublicationShare()) : 0;
    int thesis = hasThesis ? topK - publication : 0;
    boolean mixesRoles =
        intent == RetrievalIntent.TECHNICAL_CROSS_PAPER
            || intent == RetrievalIntent.RESEARCH_OVERVIEW
            || intent == RetrievalIntent.FUTURE_DIRECTIONS;
    if (mixesRoles && hasPublications) {
      publication = Math.max(1, publication);
      thesis = hasThesis ? Math.max(0, topK - publication) : 0;
    }
    return new RoleSplit(publication, thesis);
  }

  record RoleSplit(int publication, int thesis) {}
}
