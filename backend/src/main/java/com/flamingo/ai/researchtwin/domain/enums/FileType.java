package com.flamingo.ai.researchtwin.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Original file format of an ingested document. */
public enum FileType {
  PDF("pdf"),
  DOCX("docx"),
  TXT("txt");

  private final String value;

  FileType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Unknown values default to {@link #TXT}. */
  public static FileType parse(String raw) {
    for (FileType type : values()) {
      if (type.value.equals(raw)) {
        return type;
      }
    }
    return TXT;
  }

  public static FileType fromFileName(String fileName) {
    String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".pdf")) {
      return PDF;
    }
    if (lower.endsWith(".docx")) {
      return DOCX;
    }
    return TXT;
  }
}
