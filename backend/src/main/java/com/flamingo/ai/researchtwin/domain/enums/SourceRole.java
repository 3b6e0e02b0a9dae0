package com.flamingo.ai.researchtwin.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/** Classifies a document (and its chunks) by where its text came from. */
public enum SourceRole {
  /** A published paper; canonical for factual and quantitative claims. */
  PUBLICATION("publication"),

  /** The researcher's thesis; used for narrative framing and synthesis. */
  THESIS("thesis"),

  /** A crawled web page. */
  WEB("web"),

  OTHER("other");

  private static final Pattern THESIS_NAME =
      Pattern.compile("thesis|dissertation", Pattern.CASE_INSENSITIVE);

  private final String value;

  SourceRole(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Parses a stored or user-supplied role, ignoring case and surrounding whitespace. */
  public static Optional<SourceRole> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    for (SourceRole role : values()) {
      if (role.value.equals(normalized)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }

  /** Infers a role from the file name when none was given explicitly. */
  public static SourceRole infer(String fileName, SourceType sourceType) {
    if (sourceType == SourceType.CRAWL) {
      return WEB;
    }
    if (fileName != null && THESIS_NAME.matcher(fileName).find()) {
      return THESIS;
    }
    return PUBLICATION;
  }
}
