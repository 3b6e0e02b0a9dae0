package com.flamingo.ai.researchtwin.service.rag.intent;

import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import java.util.List;

/**
 * Result of classifying a query.
 *
 * @param intent the selected retrieval intent
 * @param mentionedDocuments documents the query names, strongest mention first
 */
public record IntentClassification(RetrievalIntent intent, List<RagDocument> mentionedDocuments) {

  public IntentClassification {
    mentionedDocuments = mentionedDocuments == null ? List.of() : List.copyOf(mentionedDocuments);
  }

  /** Mentioned documents with the publication role, in mention order. */
  public List<RagDocument> mentionedPublications() {
    return mentionedDocuments.stream()
        .filter(doc -> doc.getSourceRole() == SourceRole.PUBLICATION)
        .toList();
  }
}
