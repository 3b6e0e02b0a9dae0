package com.flamingo.ai.researchtwin.service.rag.retrieval;

import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import java.util.List;

/**
 * Everything a {@link RetrievalStrategy} needs for one request: the query, its intent and
 * targets, the namespace content read once up front, and the query embedding (empty when
 * unavailable).
 */
public record RetrievalContext(
    String namespaceId,
    String query,
    RetrievalIntent intent,
    List<RagDocument> mentionedDocuments,
    List<String> targetDocumentNames,
    int topK,
    List<RagDocument> documents,
    List<RagChunk> chunks,
    List<Float> queryEmbedding) {

  public RetrievalContext {
    mentionedDocuments = List.copyOf(mentionedDocuments);
    targetDocumentNames = List.copyOf(targetDocumentNames);
    documents = List.copyOf(documents);
    chunks = List.copyOf(chunks);
    queryEmbedding = queryEmbedding == null ? List.of() : queryEmbedding;
  }

  public boolean hasDocumentsWithRole(SourceRole role) {
    return documents.stream().anyMatch(doc -> doc.getSourceRole() == role);
  }

  public boolean hasTargets() {
    return !targetDocumentNames.isEmpty();
  }

  /** Builds a result carrying this context's intent, mentions and targets. */
  public RetrievalResult result(List<RagChunk> selected, List<String> targets, String note) {
    return new RetrievalResult(intent, selected, mentionedDocuments, targets, List.of(note));
  }
}
