package com.flamingo.ai.researchtwin.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.researchtwin.domain.enums.DocumentStatus;
import com.flamingo.ai.researchtwin.domain.enums.FileType;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.enums.SourceType;
import com.flamingo.ai.researchtwin.domain.model.CorpusSnapshot;
import com.flamingo.ai.researchtwin.domain.model.DocumentMetadata;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import com.flamingo.ai.researchtwin.service.rag.similarity.TextKeys;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw stored JSON into validated domain records.
 *
 * <p>Records missing a required identifier are dropped without error; optional fields fall back
 * to safe defaults and derived fields (text hash, paper key, title) are backfilled. This keeps a
 * hand-edited or partially written store file usable.
 */
final class CorpusRecordNormalizer {

  private CorpusRecordNormalizer() {}

  static CorpusSnapshot normalize(JsonNode root) {
    if (root == null || !root.isObject()) {
      return CorpusSnapshot.empty();
    }
    List<RagDocument> documents = new ArrayList<>();
    JsonNode rawDocuments = root.get("documents");
    if (rawDocuments != null && rawDocuments.isArray()) {
      for (JsonNode raw : rawDocuments) {
        normalizeDocument(raw).ifPresent(documents::add);
      }
    }

    CorpusSnapshot snapshot = new CorpusSnapshot(documents, List.of());
    Map<String, RagDocument> documentsById = snapshot.documentsById();
    JsonNode rawChunks = root.get("chunks");
    if (rawChunks != null && rawChunks.isArray()) {
      for (JsonNode raw : rawChunks) {
        normalizeChunk(raw, documentsById).ifPresent(snapshot.chunks()::add);
      }
    }
    return snapshot;
  }

  static Optional<RagDocument> normalizeDocument(JsonNode raw) {
    if (raw == null || !raw.isObject()) {
      return Optional.empty();
    }
    String id = text(raw, "id");
    String namespaceId = text(raw, "namespaceId");
    String fileName = text(raw, "fileName");
    if (id == null || namespaceId == null || fileName == null) {
      return Optional.empty();
    }

    SourceType sourceType = SourceType.parse(text(raw, "sourceType"));
    SourceRole inferredRole = SourceRole.infer(fileName, sourceType);
    Integer documentCount = integer(raw.get("documentCount"));

    return Optional.of(
        RagDocument.builder()
            .id(id)
            .namespaceId(namespaceId)
            .fileName(fileName)
            .fileType(FileType.parse(text(raw, "fileType")))
            .status(DocumentStatus.parse(text(raw, "status")))
            .uploadedAt(instant(raw.get("uploadedAt")))
            .sourceType(sourceType)
            .sourceRef(text(raw, "sourceRef"))
            .documentCount(documentCount == null ? 0 : documentCount)
            .sourceRole(SourceRole.parse(text(raw, "sourceRole")).orElse(inferredRole))
            .metadata(metadata(raw.get("metadata")))
            .build());
  }

  static Optional<RagChunk> normalizeChunk(JsonNode raw, Map<String, RagDocument> documentsById) {
    if (raw == null || !raw.isObject()) {
      return Optional.empty();
    }
    String id = text(raw, "id");
    String namespaceId = text(raw, "namespaceId");
    String documentId = text(raw, "documentId");
    String chunkText = text(raw, "text");
    String sourceName = text(raw, "sourceName");
    if (id == null || namespaceId == null || documentId == null || chunkText == null
        || sourceName == null) {
      return Optional.empty();
    }

    RagDocument owner = documentsById.get(documentId);
    SourceRole fallbackRole = owner != null ? owner.getSourceRole() : SourceRole.OTHER;
    DocumentMetadata ownerMetadata = owner != null ? owner.getMetadata() : null;
    String ownerTitle = ownerMetadata != null ? ownerMetadata.getTitle() : null;

    String paperKey = text(raw, "paperKey");
    String documentTitle = text(raw, "documentTitle");
    String textHash = text(raw, "textHash");
    Integer chunkIndex = integer(raw.get("chunkIndex"));
    JsonNode redundantFlag = raw.get("isRedundant");

    return Optional.of(
        RagChunk.builder()
            .id(id)
            .namespaceId(namespaceId)
            .documentId(documentId)
            .text(chunkText)
            .textHash(textHash != null ? textHash : TextKeys.textHash(chunkText))
            .embedding(embedding(raw.get("embedding")))
            .sourceName(sourceName)
            .chunkIndex(chunkIndex == null ? 0 : chunkIndex)
            .sourceRole(SourceRole.parse(text(raw, "sourceRole")).orElse(fallbackRole))
            .paperKey(paperKey != null ? paperKey : TextKeys.paperKey(sourceName, ownerTitle))
            .documentTitle(documentTitle != null ? documentTitle : ownerTitle)
            .headingPath(text(raw, "headingPath"))
            .pageStart(integer(raw.get("pageStart")))
            .pageEnd(integer(raw.get("pageEnd")))
            .redundantOf(text(raw, "redundantOf"))
            .redundancyScore(number(raw.get("redundancyScore")))
            .redundant(redundantFlag != null && redundantFlag.asBoolean(false))
            .build());
  }

  private static DocumentMetadata metadata(JsonNode raw) {
    if (raw == null || !raw.isObject()) {
      return null;
    }
    List<String> topics = new ArrayList<>();
    JsonNode rawTopics = raw.get("topics");
    if (rawTopics != null && rawTopics.isArray()) {
      for (JsonNode topic : rawTopics) {
        if (topic.isTextual()) {
          topics.add(topic.asText());
        }
      }
    }
    return DocumentMetadata.normalize(
        DocumentMetadata.builder()
            .title(text(raw, "title"))
            .year(text(raw, "year"))
            .venue(text(raw, "venue"))
            .chapter(text(raw, "chapter"))
            .section(text(raw, "section"))
            .subsection(text(raw, "subsection"))
            .topics(topics)
            .canonicalCitation(text(raw, "canonicalCitation"))
            .build());
  }

  private static List<Float> embedding(JsonNode raw) {
    if (raw == null || !raw.isArray()) {
      return null;
    }
    List<Float> vector = new ArrayList<>(raw.size());
    for (JsonNode item : raw) {
      Double value = number(item);
      if (value != null) {
        vector.add(value.floatValue());
      }
    }
    return vector.isEmpty() ? null : vector;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      return null;
    }
    return DocumentMetadata.trimToNull(value.asText());
  }

  private static Integer integer(JsonNode value) {
    Double parsed = number(value);
    return parsed == null ? null : (int) Math.floor(parsed);
  }

  private static Double number(JsonNode value) {
    if (value == null) {
      return null;
    }
    if (value.isNumber()) {
      double number = value.asDouble();
      return Double.isFinite(number) ? number : null;
    }
    if (value.isTextual()) {
      try {
        double number = Double.parseDouble(value.asText().trim());
        return Double.isFinite(number) ? number : null;
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static Instant instant(JsonNode value) {
    if (value == null) {
      return Instant.EPOCH;
    }
    if (value.isNumber()) {
      return Instant.ofEpochMilli(value.asLong());
    }
    if (value.isTextual()) {
      try {
        return Instant.parse(value.asText().trim());
      } catch (DateTimeParseException e) {
        return Instant.EPOCH;
      }
    }
    return Instant.EPOCH;
  }
}
