package com.flamingo.ai.researchtwin.service.chat;

import lombok.Builder;

/**
 * A question to answer from a namespace's corpus.
 *
 * @param namespaceId corpus namespace; blank uses the configured default
 * @param message the user question
 * @param topK maximum number of evidence chunks; non-positive uses the configured default
 */
@Builder
public record AnswerRequest(String namespaceId, String message, int topK) {}
