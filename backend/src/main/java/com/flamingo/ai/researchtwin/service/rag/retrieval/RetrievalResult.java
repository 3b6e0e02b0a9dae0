package com.flamingo.ai.researchtwin.service.rag.retrieval;

import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import java.util.List;

/**
 * Ordered evidence for one query together with how it was obtained.
 *
 * @param intent the intent the chunks were retrieved for
 * @param chunks ranked chunks, at most {@code topK}, diversity-capped
 * @param mentionedDocuments documents the query named
 * @param targetDocumentNames publication file names the retrieval was restricted to, if any
 * @param notes human-readable retrieval notes passed on to the prompt
 */
public record RetrievalResult(
    RetrievalIntent intent,
    List<RagChunk> chunks,
    List<RagDocument> mentionedDocuments,
    List<String> targetDocumentNames,
    List<String> notes) {

  public RetrievalResult {
    chunks = List.copyOf(chunks);
    mentionedDocuments = List.copyOf(mentionedDocuments);
    targetDocumentNames = List.copyOf(targetDocumentNames);
    notes = List.copyOf(notes);
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }
}
