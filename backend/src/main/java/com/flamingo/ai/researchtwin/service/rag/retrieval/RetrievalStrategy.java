package com.flamingo.ai.researchtwin.service.rag.retrieval;

import java.util.Optional;

/**
 * One rung of the retrieval ladder. The engine evaluates strategies in {@link
 * org.springframework.core.annotation.Order} order and returns the first result produced.
 */
public interface RetrievalStrategy {

  /** Short name used in logs and the fallback metric. */
  String name();

  /** Whether this strategy handles the request at all. */
  default boolean supports(RetrievalContext context) {
    return true;
  }

  /**
   * Attempts retrieval for a request this strategy supports.
   *
   * @param context the request context
   * @return a result to return as-is, or empty to let the next strategy try
   */
  Optional<RetrievalResult> retrieve(RetrievalContext context);
}
