package com.flamingo.ai.researchtwin.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.researchtwin.domain.enums.DocumentStatus;
import com.flamingo.ai.researchtwin.domain.enums.FileType;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.enums.SourceType;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One ingested source unit. {@code (namespaceId, fileName)} is the logical replace key: ingesting
 * the same file name again supersedes this document and its chunks.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RagDocument {

  private String id;
  private String namespaceId;
  private String fileName;
  private FileType fileType;
  private DocumentStatus status;
  private Instant uploadedAt;
  private SourceType sourceType;

  /** Origin locator, e.g. the crawled URL. */
  private String sourceRef;

  /** Number of chunks the document produced. */
  private int documentCount;

  private SourceRole sourceRole;
  private DocumentMetadata metadata;

  /** Title from metadata, if any. */
  public String title() {
    return metadata != null ? metadata.getTitle() : null;
  }
}
