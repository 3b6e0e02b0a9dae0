package com.flamingo.ai.researchtwin.service.rag.retrieval;

import com.flamingo.ai.researchtwin.domain.enums.DocumentStatus;
import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import java.util.ArrayList;
import java.util.List;

/** Builders for retrieval test corpora. */
public final class RetrievalFixtures {

  private RetrievalFixtures() {}

  public static RagDocument document(String fileName, SourceRole role) {
    return RagDocument.builder()
        .id("doc-" + fileName)
        .namespaceId("ns")
        .fileName(fileName)
        .status(DocumentStatus.ACTIVE)
        .sourceRole(role)
        .build();
  }

  /** {@code count} chunks of the document, each mentioning normalization and adaptation. */
  public static List<RagChunk> chunks(RagDocument document, int count) {
    List<RagChunk> chunks = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      String text = "Chunk " + i + " of " + document.getFileName();
      chunks.add(chunk(document, i, text + " on normalization and adaptation."));
    }
    return chunks;
  }

  public static RagChunk chunk(RagDocument document, int index, String text) {
    return RagChunk.builder()
        .id(document.getFileName() + "#" + index)
        .namespaceId("ns")
        .documentId(document.getId())
        .sourceName(document.getFileName())
        .sourceRole(document.getSourceRole())
        .chunkIndex(index)
        .text(text)
        .build();
  }

  public static RetrievalContext context(
      RetrievalIntent intent,
      List<String> targets,
      int topK,
      List<RagDocument> documents,
      List<RagChunk> chunks) {
    return new RetrievalContext(
        "ns",
        "normalization adaptation",
        intent,
        List.of(),
        targets,
        topK,
        documents,
        chunks,
        List.of());
  }
}
