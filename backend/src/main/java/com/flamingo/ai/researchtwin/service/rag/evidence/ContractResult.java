package com.flamingo.ai.researchtwin.service.rag.evidence;

import java.util.List;

/**
 * Output of evidence contract enforcement.
 *
 * @param responseText the repaired answer including the notes and evidence blocks
 * @param citations deduplicated citations built from every reference
 * @param complianceNotes notes appended to the answer
 * @param strippedMarkers number of unknown markers removed from the model text
 * @param primaryEvidenceAdded whether a primary evidence line was synthesized
 */
public record ContractResult(
    String responseText,
    List<Citation> citations,
    List<String> complianceNotes,
    int strippedMarkers,
    boolean primaryEvidenceAdded) {}
