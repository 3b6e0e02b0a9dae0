package com.flamingo.ai.researchtwin.service.rag.evidence;

import com.flamingo.ai.researchtwin.domain.enums.EvidenceLabel;
import com.flamingo.ai.researchtwin.domain.model.DocumentMetadata;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Assigns citation markers to retrieved chunks. Markers are numbered per prefix in retrieval
 * order ({@code P1, P2, T1, TR1, ...}); display fields prefer the canonical catalog, then the
 * owning document's metadata, then the chunk itself.
 */
@Component
@RequiredArgsConstructor
public class EvidenceReferenceBuilder {

  static final String UNKNOWN = "N/A";

  private final CanonicalPublicationCatalog catalog;

  public List<EvidenceReference> build(List<RagChunk> chunks, List<RagDocument> documents) {
    if (chunks == null || chunks.isEmpty()) {
      return List.of();
    }
    Map<String, RagDocument> documentsById =
        documents == null
            ? Map.of()
            : documents.stream()
                .collect(Collectors.toMap(RagDocument::getId, Function.identity(), (a, b) -> b));

    Map<EvidenceLabel, Integer> counters = new EnumMap<>(EvidenceLabel.class);
    List<EvidenceReference> references = new ArrayList<>();
    for (RagChunk chunk : chunks) {
      EvidenceLabel label = labelFor(chunk);
      String marker = label.getMarkerPrefix() + counters.merge(label, 1, Integer::sum);
      references.add(resolve(chunk, label, marker, documentsById.get(chunk.getDocumentId())));
    }
    return references;
  }

  public static EvidenceLabel labelFor(RagChunk chunk) {
    if (chunk.getSourceRole() == null) {
      return EvidenceLabel.SOURCE;
    }
    return switch (chunk.getSourceRole()) {
      case PUBLICATION -> EvidenceLabel.PAPER;
      case THESIS ->
          chunk.isRedundantThesis() ? EvidenceLabel.THESIS_REDUNDANT : EvidenceLabel.THESIS;
      case WEB -> EvidenceLabel.WEB;
      default -> EvidenceLabel.SOURCE;
    };
  }

  private EvidenceReference resolve(
      RagChunk chunk, EvidenceLabel label, String marker, RagDocument document) {
    DocumentMetadata metadata = document != null ? document.getMetadata() : null;
    String sourceName = document != null ? document.getFileName() : chunk.getSourceName();
    String metadataTitle = metadata != null ? metadata.getTitle() : null;
    String metadataVenue = metadata != null ? metadata.getVenue() : null;
    String metadataYear = metadata != null ? metadata.getYear() : null;
    String fallbackTitle =
        firstPresent(metadataTitle, chunk.getDocumentTitle(), chunk.getSourceName());

    if (label == EvidenceLabel.PAPER) {
      Optional<CanonicalPublication> canonical =
          catalog.resolveFromCandidates(
              Arrays.asList(
                  metadataTitle,
                  metadata != null ? metadata.getCanonicalCitation() : null,
                  document != null ? document.getFileName() : null,
                  chunk.getSourceName(),
                  chunk.getDocumentTitle(),
                  chunk.getPaperKey()));
      return new EvidenceReference(
          marker,
          label,
          sourceName,
          canonical.map(CanonicalPublication::title).orElse(fallbackTitle),
          canonical.map(CanonicalPublication::venue).orElse(firstPresent(metadataVenue, UNKNOWN)),
          canonical.map(CanonicalPublication::year).orElse(firstPresent(metadataYear, UNKNOWN)),
          chunk.getId());
    }

    String venue = label == EvidenceLabel.WEB ? "WEB" : firstPresent(metadataVenue, UNKNOWN);
    return new EvidenceReference(
        marker,
        label,
        sourceName,
        fallbackTitle,
        venue,
        firstPresent(metadataYear, UNKNOWN),
        chunk.getId());
  }

  private static String firstPresent(String... values) {
    return Arrays.stream(values)
        .filter(Objects::nonNull)
        .filter(value -> !value.isBlank())
        .findFirst()
        .orElse(UNKNOWN);
  }
}
