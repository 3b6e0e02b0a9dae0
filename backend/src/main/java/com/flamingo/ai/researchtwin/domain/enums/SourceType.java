package com.flamingo.ai.researchtwin.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a document entered the corpus. */
public enum SourceType {
  UPLOAD("upload"),
  CRAWL("crawl");

  private final String value;

  SourceType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Anything other than {@code crawl} is treated as an upload. */
  public static SourceType parse(String raw) {
    return CRAWL.value.equals(raw) ? CRAWL : UPLOAD;
  }
}
