package com.flamingo.ai.researchtwin.service.rag.evidence;

import com.flamingo.ai.researchtwin.domain.enums.EvidenceLabel;

/**
 * A retrieved chunk bound to a citation marker.
 *
 * @param marker marker without brackets, e.g. {@code P1}
 * @param label evidence class of the chunk
 * @param sourceName file name of the source document
 * @param title display title
 * @param venue display venue, {@code N/A} when unknown
 * @param year display year, {@code N/A} when unknown
 * @param chunkId id of the referenced chunk
 */
public record EvidenceReference(
    String marker,
    EvidenceLabel label,
    String sourceName,
    String title,
    String venue,
    String year,
    String chunkId) {

  /** The marker as it appears in answer text, e.g. {@code [P1]}. */
  public String bracketed() {
    return "[" + marker + "]";
  }
}
