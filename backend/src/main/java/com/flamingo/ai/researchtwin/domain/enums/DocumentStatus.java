package com.flamingo.ai.researchtwin.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle status of an ingested document. */
public enum DocumentStatus {
  /** Document produced at least one chunk and is searchable. */
  ACTIVE("active"),

  /** Document produced no text to chunk. */
  FAILED("failed"),

  /** Document was soft-deleted; its chunks have been purged. */
  DELETED("deleted");

  private final String value;

  DocumentStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Unknown values are treated as {@link #FAILED}. */
  public static DocumentStatus parse(String raw) {
    for (DocumentStatus status : values()) {
      if (status.value.equals(raw)) {
        return status;
      }
    }
    return FAILED;
  }
}
