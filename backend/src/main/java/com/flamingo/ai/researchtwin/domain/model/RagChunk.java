package com.flamingo.ai.researchtwin.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A retrievable text window owned by exactly one {@link RagDocument}.
 *
 * <p>The redundancy fields ({@code redundantOf}, {@code redundancyScore}, {@code redundant}) are
 * recomputed wholesale whenever the namespace corpus changes and only carry meaning for thesis
 * chunks.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RagChunk {

  private String id;
  private String namespaceId;
  private String documentId;
  private String text;

  /** SHA-1 of the normalized text, used for exact duplicate detection. */
  private String textHash;

  private List<Float> embedding;

  /** File name of the owning document (denormalized). */
  private String sourceName;

  private int chunkIndex;
  private SourceRole sourceRole;

  /** Normalized title/file-name key grouping chunks of the same logical paper across roles. */
  private String paperKey;

  private String documentTitle;
  private String headingPath;
  private Integer pageStart;
  private Integer pageEnd;

  private String redundantOf;
  private Double redundancyScore;
  @JsonProperty("isRedundant")
  private boolean redundant;

  @JsonIgnore
  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }

  /** A thesis chunk that duplicates a publication chunk without adding material content. */
  @JsonIgnore
  public boolean isRedundantThesis() {
    return sourceRole == SourceRole.THESIS && redundant && redundantOf != null;
  }

  /** Clears all redundancy annotations. */
  public void clearRedundancy() {
    this.redundant = false;
    this.redundantOf = null;
    this.redundancyScore = null;
  }

  /** Marks this chunk as a duplicate of the given publication chunk. */
  public void markRedundant(String publicationChunkId, double score) {
    this.redundant = true;
    this.redundantOf = publicationChunkId;
    this.redundancyScore = score;
  }
}
