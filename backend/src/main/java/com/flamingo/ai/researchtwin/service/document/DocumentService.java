package com.flamingo.ai.researchtwin.service.document;

import com.flamingo.ai.researchtwin.domain.model.DocumentMetadata;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import java.util.Collection;
import java.util.List;

/** Service interface for corpus document management. */
public interface DocumentService {

  /**
   * Chunks, embeds and stores a document, replacing any earlier document with the same file name
   * in the namespace. Thesis redundancy is recomputed before the snapshot is written.
   *
   * @param command the ingestion request
   * @return the stored document; {@code failed} when the text produced no chunks
   * @throws com.flamingo.ai.researchtwin.exception.DocumentProcessingException if the namespace or
   *     file name is blank
   */
  RagDocument ingestDocument(IngestCommand command);

  /**
   * Ingests the text of a crawled web page with the {@code web} role.
   *
   * @param namespaceId the namespace
   * @param url the page URL
   * @param html the page markup
   * @param metadata optional metadata
   * @return the stored document
   * @throws com.flamingo.ai.researchtwin.exception.DocumentProcessingException if the URL is
   *     invalid or the page has too little text
   */
  RagDocument ingestCrawledPage(
      String namespaceId, String url, String html, DocumentMetadata metadata);

  /**
   * Lists documents that have not been deleted.
   *
   * @param namespaceId the namespace
   * @return visible documents in store order
   */
  List<RagDocument> listDocuments(String namespaceId);

  /**
   * Soft-deletes documents by file name and purges their chunks.
   *
   * @param namespaceId the namespace
   * @param fileNames file names to delete
   * @return number of documents marked deleted
   */
  int deleteDocuments(String namespaceId, Collection<String> fileNames);
}
