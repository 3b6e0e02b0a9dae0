package com.flamingo.ai.researchtwin.service.document;

import com.flamingo.ai.researchtwin.domain.enums.DocumentStatus;
import com.flamingo.ai.researchtwin.domain.enums.FileType;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.enums.SourceType;
import com.flamingo.ai.researchtwin.domain.model.CorpusSnapshot;
import com.flamingo.ai.researchtwin.domain.model.DocumentMetadata;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import com.flamingo.ai.researchtwin.exception.DocumentProcessingException;
import com.flamingo.ai.researchtwin.service.rag.chunking.SlidingWindowChunker;
import com.flamingo.ai.researchtwin.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.researchtwin.service.rag.evidence.CanonicalPublicationCatalog;
import com.flamingo.ai.researchtwin.service.rag.redundancy.RedundancyAnnotator;
import com.flamingo.ai.researchtwin.service.rag.similarity.TextKeys;
import com.flamingo.ai.researchtwin.store.CorpusStore;
import com.flamingo.ai.researchtwin.store.NamespaceLocks;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Implementation of the DocumentService. */
@Service
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  static final int MIN_CRAWLED_TEXT_LENGTH = 100;

  private final CorpusStore corpusStore;
  private final NamespaceLocks namespaceLocks;
  private final SlidingWindowChunker chunker;
  private final EmbeddingService embeddingService;
  private final RedundancyAnnotator redundancyAnnotator;
  private final CanonicalPublicationCatalog catalog;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  @Autowired
  public DocumentServiceImpl(
      CorpusStore corpusStore,
      NamespaceLocks namespaceLocks,
      SlidingWindowChunker chunker,
      EmbeddingService embeddingService,
      RedundancyAnnotator redundancyAnnotator,
      CanonicalPublicationCatalog catalog,
      MeterRegistry meterRegistry) {
    this(
        corpusStore,
        namespaceLocks,
        chunker,
        embeddingService,
        redundancyAnnotator,
        catalog,
        meterRegistry,
        Clock.systemUTC());
  }

  DocumentServiceImpl(
      CorpusStore corpusStore,
      NamespaceLocks namespaceLocks,
      SlidingWindowChunker chunker,
      EmbeddingService embeddingService,
      RedundancyAnnotator redundancyAnnotator,
      CanonicalPublicationCatalog catalog,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.corpusStore = corpusStore;
    this.namespaceLocks = namespaceLocks;
    this.chunker = chunker;
    this.embeddingService = embeddingService;
    this.redundancyAnnotator = redundancyAnnotator;
    this.catalog = catalog;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Override
  @Timed(value = "document.ingest", description = "Time to ingest a document")
  public RagDocument ingestDocument(IngestCommand command) {
    String namespaceId = requireText(command.namespaceId(), command.fileName(), "namespace id");
    String fileName = requireText(command.fileName(), command.fileName(), "file name");

    SourceType sourceType = command.sourceType() != null ? command.sourceType() : SourceType.UPLOAD;
    SourceRole role =
        command.sourceRole() != null
            ? command.sourceRole()
            : SourceRole.infer(fileName, sourceType);
    DocumentMetadata metadata =
        catalog.withCanonicalMetadata(fileName, DocumentMetadata.normalize(command.metadata()));
    String title = metadata != null ? metadata.getTitle() : null;
    String paperKey = TextKeys.paperKey(fileName, title);
    String documentId = UUID.randomUUID().toString();

    log.info("Ingesting {} into namespace {} as {}", fileName, namespaceId, role.getValue());

    // embedding happens outside the namespace lock
    List<String> texts = chunker.chunk(command.text(), role);
    List<RagChunk> chunks = new ArrayList<>(texts.size());
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i);
      List<Float> embedding = embeddingService.embedPassage(text);
      chunks.add(
          RagChunk.builder()
              .id(UUID.randomUUID().toString())
              .namespaceId(namespaceId)
              .documentId(documentId)
              .text(text)
              .textHash(TextKeys.textHash(text))
              .embedding(embedding == null || embedding.isEmpty() ? null : embedding)
              .sourceName(fileName)
              .chunkIndex(i)
              .sourceRole(role)
              .paperKey(paperKey)
              .documentTitle(title)
              .build());
    }

    RagDocument document =
        RagDocument.builder()
            .id(documentId)
            .namespaceId(namespaceId)
            .fileName(fileName)
            .fileType(
                command.fileType() != null ? command.fileType() : FileType.fromFileName(fileName))
            .status(chunks.isEmpty() ? DocumentStatus.FAILED : DocumentStatus.ACTIVE)
            .uploadedAt(Instant.now(clock))
            .sourceType(sourceType)
            .sourceRef(DocumentMetadata.trimToNull(command.sourceRef()))
            .documentCount(chunks.size())
            .sourceRole(role)
            .metadata(metadata)
            .build();

    int replaced =
        namespaceLocks.withLock(
            namespaceId,
            () -> {
              CorpusSnapshot snapshot = corpusStore.read(namespaceId);
              Set<String> replacedIds =
                  snapshot.documents().stream()
                      .filter(doc -> fileName.equals(doc.getFileName()))
                      .map(RagDocument::getId)
                      .collect(Collectors.toSet());
              snapshot.documents().removeIf(doc -> replacedIds.contains(doc.getId()));
              snapshot.chunks().removeIf(chunk -> replacedIds.contains(chunk.getDocumentId()));
              snapshot.documents().add(document);
              snapshot.chunks().addAll(chunks);
              redundancyAnnotator.annotate(snapshot.chunks(), namespaceId);
              corpusStore.writeAll(namespaceId, snapshot);
              return replacedIds.size();
            });

    if (document.getStatus() == DocumentStatus.FAILED) {
      meterRegistry.counter("rag.ingest.failed").increment();
      log.warn("Document {} produced no chunks and was stored as failed", fileName);
    } else {
      meterRegistry.counter("rag.ingest.documents", "role", role.getValue()).increment();
    }
    log.info(
        "Ingested {} into namespace {}: {} chunks, replaced {} earlier documents",
        fileName,
        namespaceId,
        chunks.size(),
        replaced);
    return document;
  }

  @Override
  public RagDocument ingestCrawledPage(
      String namespaceId, String url, String html, DocumentMetadata metadata) {
    URI uri;
    try {
      uri = new URI(url == null ? "" : url.trim());
    } catch (URISyntaxException e) {
      throw new DocumentProcessingException(
          url, "Invalid page URL: " + e.getMessage(), "Invalid URL");
    }
    if (uri.getHost() == null) {
      throw new DocumentProcessingException(url, "Page URL has no host", "Invalid URL");
    }

    String text = HtmlText.toText(html);
    if (text.length() < MIN_CRAWLED_TEXT_LENGTH) {
      throw new DocumentProcessingException(
          url,
          "Crawled page has only " + text.length() + " characters of text",
          "Crawled page did not contain enough extractable text");
    }

    return ingestDocument(
        IngestCommand.builder()
            .namespaceId(namespaceId)
            .fileName(HtmlText.fileNameFor(uri))
            .fileType(FileType.TXT)
            .text(text)
            .sourceType(SourceType.CRAWL)
            .sourceRef(uri.toString())
            .sourceRole(SourceRole.WEB)
            .metadata(metadata)
            .build());
  }

  @Override
  public List<RagDocument> listDocuments(String namespaceId) {
    return corpusStore.read(namespaceId).visibleDocuments();
  }

  @Override
  @Timed(value = "document.delete", description = "Time to delete documents")
  public int deleteDocuments(String namespaceId, Collection<String> fileNames) {
    if (fileNames == null || fileNames.isEmpty()) {
      return 0;
    }
    Set<String> names = new HashSet<>(fileNames);
    int deleted =
        namespaceLocks.withLock(
            namespaceId,
            () -> {
              CorpusSnapshot snapshot = corpusStore.read(namespaceId);
              Set<String> deletedIds = new HashSet<>();
              for (RagDocument doc : snapshot.documents()) {
                boolean visible = doc.getStatus() != DocumentStatus.DELETED;
                if (visible && names.contains(doc.getFileName())) {
                  doc.setStatus(DocumentStatus.DELETED);
                  deletedIds.add(doc.getId());
                }
              }
              if (deletedIds.isEmpty()) {
                return 0;
              }
              snapshot.chunks().removeIf(chunk -> deletedIds.contains(chunk.getDocumentId()));
              redundancyAnnotator.annotate(snapshot.chunks(), namespaceId);
              corpusStore.writeAll(namespaceId, snapshot);
              return deletedIds.size();
            });

    meterRegistry.counter("rag.delete.documents").increment(deleted);
    log.info("Deleted {} documents from namespace {}", deleted, namespaceId);
    return deleted;
  }

  private static String requireText(String value, String fileName, String field) {
    String trimmed = DocumentMetadata.trimToNull(value);
    if (trimmed == null) {
      throw new DocumentProcessingException(
          fileName, "Missing " + field, "A " + field + " is required");
    }
    return trimmed;
  }
}
