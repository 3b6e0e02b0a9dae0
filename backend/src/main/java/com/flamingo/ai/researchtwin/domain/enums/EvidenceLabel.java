package com.flamingo.ai.researchtwin.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Evidence class of a retrieved chunk, with the citation marker prefix it is numbered under. */
public enum EvidenceLabel {
  PAPER("PAPER", "P"),
  THESIS("THESIS", "T"),
  THESIS_REDUNDANT("THESIS-REDUNDANT", "TR"),
  WEB("WEB", "W"),
  SOURCE("SOURCE", "S");

  private final String display;
  private final String markerPrefix;

  EvidenceLabel(String display, String markerPrefix) {
    this.display = display;
    this.markerPrefix = markerPrefix;
  }

  @JsonValue
  public String getDisplay() {
    return display;
  }

  public String getMarkerPrefix() {
    return markerPrefix;
  }

  public boolean isThesis() {
    return this == THESIS || this == THESIS_REDUNDANT;
  }
}
