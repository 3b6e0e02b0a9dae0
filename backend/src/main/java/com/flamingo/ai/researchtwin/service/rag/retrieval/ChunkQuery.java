package com.flamingo.ai.researchtwin.service.rag.retrieval;

import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import java.util.List;
import java.util.Set;
import lombok.Builder;

/**
 * Filters and limits for one ranked pass over a namespace's chunks.
 *
 * @param topK maximum number of chunks returned
 * @param roles source roles to keep; empty keeps every role
 * @param documentNames file names to keep; empty keeps every document
 * @param excludeRedundant drop chunks flagged redundant
 * @param maxChunksPerDocument per-document cap; zero or less disables it
 */
@Builder(toBuilder = true)
public record ChunkQuery(
    int topK,
    Set<SourceRole> roles,
    List<String> documentNames,
    boolean excludeRedundant,
    int maxChunksPerDocument) {

  public ChunkQuery {
    roles = roles == null ? Set.of() : Set.copyOf(roles);
    documentNames = documentNames == null ? List.of() : List.copyOf(documentNames);
  }

  public static ChunkQuery publications(int topK, int maxChunksPerDocument) {
    return ChunkQuery.builder()
        .topK(topK)
        .roles(Set.of(SourceRole.PUBLICATION))
        .excludeRedundant(true)
        .maxChunksPerDocument(maxChunksPerDocument)
        .build();
  }
}
