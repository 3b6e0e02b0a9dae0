package com.flamingo.ai.researchtwin.service.chat;

import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.service.rag.evidence.Citation;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

/**
 * An evidence-bound answer.
 *
 * @param responseText answer text with inline markers, notes and evidence listing
 * @param citations citations built from the retrieved evidence
 * @param suggestedFollowups follow-up questions proposed by the model
 * @param intent the detected retrieval intent
 * @param retrievalNotes notes describing how evidence was selected
 * @param timestamp when the answer was produced
 */
@Builder
public record AnswerResponse(
    String responseText,
    List<Citation> citations,
    List<String> suggestedFollowups,
    RetrievalIntent intent,
    List<String> retrievalNotes,
    Instant timestamp) {}
