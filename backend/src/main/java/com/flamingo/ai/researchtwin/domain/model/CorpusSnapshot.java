package com.flamingo.ai.researchtwin.domain.model;

import com.flamingo.ai.researchtwin.domain.enums.DocumentStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Whole-namespace state as read from and written to the corpus store. The lists are mutable so
 * ingestion and deletion can edit a snapshot before writing it back.
 */
public record CorpusSnapshot(List<RagDocument> documents, List<RagChunk> chunks) {

  public CorpusSnapshot {
    documents = documents == null ? new ArrayList<>() : new ArrayList<>(documents);
    chunks = chunks == null ? new ArrayList<>() : new ArrayList<>(chunks);
  }

  public static CorpusSnapshot empty() {
    return new CorpusSnapshot(new ArrayList<>(), new ArrayList<>());
  }

  /** Documents that have not been soft-deleted. */
  public List<RagDocument> visibleDocuments() {
    return documents.stream().filter(doc -> doc.getStatus() != DocumentStatus.DELETED).toList();
  }

  public Map<String, RagDocument> documentsById() {
    return documents.stream()
        .collect(Collectors.toMap(RagDocument::getId, Function.identity(), (a, b) -> b));
  }
}
