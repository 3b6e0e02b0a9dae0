package com.flamingo.ai.researchtwin.service.rag.evidence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchtwin.domain.model.DocumentMetadata;
import com.flamingo.ai.researchtwin.service.rag.similarity.TextKeys;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

/**
 * Read-only catalog of the researcher's published papers, loaded from {@value #RESOURCE} on the
 * classpath. Used to enrich ingested metadata and to resolve citation fields for publication
 * evidence.
 */
@Component
@Slf4j
public class CanonicalPublicationCatalog {

  static final String RESOURCE = "canonical-publications.json";

  private static final int PARTIAL_MATCH_MIN_LENGTH = 6;

  private final List<CanonicalPublication> publications;

  @Autowired
  public CanonicalPublicationCatalog(ObjectMapper objectMapper) {
    this(load(objectMapper));
  }

  public CanonicalPublicationCatalog(List<CanonicalPublication> publications) {
    this.publications = List.copyOf(publications);
    log.info("Loaded {} canonical publications", this.publications.size());
  }

  public List<CanonicalPublication> getPublications() {
    return publications;
  }

  /**
   * Resolves a catalog entry by upload file name: an alias equal to the normalized file name or
   * stem, or a long alias contained in either.
   */
  public Optional<CanonicalPublication> resolveByFileName(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return Optional.empty();
    }
    String normalizedName = TextKeys.matchText(fileName);
    String stem = TextKeys.matchText(TextKeys.fileStem(fileName));
    for (CanonicalPublication publication : publications) {
      for (String alias : aliases(publication)) {
        if (alias.equals(normalizedName) || alias.equals(stem)) {
          return Optional.of(publication);
        }
        if (alias.length() >= PARTIAL_MATCH_MIN_LENGTH
            && (normalizedName.contains(alias) || stem.contains(alias))) {
          return Optional.of(publication);
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Resolves the first catalog entry matching any candidate string (titles, file names, paper
   * keys). Candidates are tried in order; long strings may match by containment either way.
   */
  public Optional<CanonicalPublication> resolveFromCandidates(List<String> candidates) {
    List<String> normalized =
        candidates.stream()
            .filter(Objects::nonNull)
            .map(TextKeys::matchText)
            .filter(candidate -> !candidate.isEmpty())
            .toList();
    for (String candidate : normalized) {
      for (CanonicalPublication publication : publications) {
        for (String alias : aliases(publication)) {
          if (candidate.equals(alias)
              || (alias.length() >= PARTIAL_MATCH_MIN_LENGTH && candidate.contains(alias))
              || (candidate.length() >= PARTIAL_MATCH_MIN_LENGTH && alias.contains(candidate))) {
            return Optional.of(publication);
          }
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Fills empty title, year, venue and citation fields from the catalog entry matching the file
   * name. Fields already set are kept.
   *
   * @return the enriched metadata, the input unchanged when nothing matches, or {@code null}
   */
  public DocumentMetadata withCanonicalMetadata(String fileName, DocumentMetadata metadata) {
    Optional<CanonicalPublication> canonical = resolveByFileName(fileName);
    if (canonical.isEmpty()) {
      return metadata;
    }
    CanonicalPublication publication = canonical.get();
    DocumentMetadata base = metadata != null ? metadata : new DocumentMetadata();
    return DocumentMetadata.normalize(
        base.toBuilder()
            .title(firstNonBlank(base.getTitle(), publication.title()))
            .year(firstNonBlank(base.getYear(), publication.year()))
            .venue(firstNonBlank(base.getVenue(), publication.venue()))
            .canonicalCitation(firstNonBlank(base.getCanonicalCitation(), publication.citation()))
            .build());
  }

  private static List<String> aliases(CanonicalPublication publication) {
    return Stream.concat(Stream.of(publication.title()), publication.aliases().stream())
        .map(TextKeys::matchText)
        .filter(alias -> !alias.isEmpty())
        .toList();
  }

  private static String firstNonBlank(String value, String fallback) {
    return value != null && !value.isBlank() ? value : fallback;
  }

  private static List<CanonicalPublication> load(ObjectMapper objectMapper) {
    try (InputStream in = new ClassPathResource(RESOURCE).getInputStream()) {
      return objectMapper.readValue(in, new TypeReference<List<CanonicalPublication>>() {});
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load " + RESOURCE, e);
    }
  }
}
