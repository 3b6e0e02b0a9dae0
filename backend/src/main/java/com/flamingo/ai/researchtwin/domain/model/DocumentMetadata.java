package com.flamingo.ai.researchtwin.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import java.util.Objects;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Optional bibliographic and structural metadata attached to a document. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DocumentMetadata {

  private String title;
  private String year;
  private String venue;
  private String chapter;
  private String section;
  private String subsection;
  private List<String> topics;
  private String canonicalCitation;

  /**
   * Returns a copy with every text field trimmed (blank becomes absent) and empty topic lists
   * dropped, or {@code null} when nothing is left.
   */
  public static DocumentMetadata normalize(DocumentMetadata metadata) {
    if (metadata == null) {
      return null;
    }
    List<String> cleanedTopics =
        metadata.topics == null
            ? List.of()
            : metadata.topics.stream()
                .map(DocumentMetadata::trimToNull)
                .filter(Objects::nonNull)
                .toList();
    DocumentMetadata normalized =
        DocumentMetadata.builder()
            .title(trimToNull(metadata.title))
            .year(trimToNull(metadata.year))
            .venue(trimToNull(metadata.venue))
            .chapter(trimToNull(metadata.chapter))
            .section(trimToNull(metadata.section))
            .subsection(trimToNull(metadata.subsection))
            .topics(cleanedTopics.isEmpty() ? null : cleanedTopics)
            .canonicalCitation(trimToNull(metadata.canonicalCitation))
            .build();
    return normalized.isEmpty() ? null : normalized;
  }

  /** True when no field carries a value. */
  @JsonIgnore
  public boolean isEmpty() {
    return title == null
        && year == null
        && venue == null
        && chapter == null
        && section == null
        && subsection == null
        && (topics == null || topics.isEmpty())
        && canonicalCitation == null;
  }

  public static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
