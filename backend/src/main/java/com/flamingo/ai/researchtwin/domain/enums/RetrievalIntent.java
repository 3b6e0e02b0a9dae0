package com.flamingo.ai.researchtwin.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Retrieval policy class selected for a query. Each intent carries the share of the evidence
 * budget that goes to publication chunks versus thesis chunks.
 */
public enum RetrievalIntent {
  PAPER_SPECIFIC("paper_specific", 1.0, false),
  PAPER_COMPARE("paper_compare", 1.0, false),
  TECHNICAL_CROSS_PAPER("technical_cross_paper", 0.75, false),
  RESEARCH_OVERVIEW("research_overview", 0.4, true),
  FUTURE_DIRECTIONS("future_directions", 0.3, true);

  private final String value;
  private final double publicationShare;
  private final boolean thesisLed;

  RetrievalIntent(String value, double publicationShare, boolean thesisLed) {
    this.value = value;
    this.publicationShare = publicationShare;
    this.thesisLed = thesisLed;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public double getPublicationShare() {
    return publicationShare;
  }

  public double getThesisShare() {
    return 1.0 - publicationShare;
  }

  /**
   * Whether thesis chunks lead the interleaved evidence list. Thesis-led intents may also surface
   * redundant thesis chunks for narrative framing.
   */
  public boolean isThesisLed() {
    return thesisLed;
  }
}
