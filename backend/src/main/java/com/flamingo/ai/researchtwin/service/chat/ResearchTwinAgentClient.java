package com.flamingo.ai.researchtwin.service.chat;

import com.flamingo.ai.researchtwin.agent.ResearchTwinAgent;
import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.exception.LlmServiceException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Calls the research twin agent with retry and circuit breaking. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchTwinAgentClient {

  private final ResearchTwinAgent researchTwinAgent;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Sends a composed prompt to the chat model.
   *
   * @param prompt the composed prompt
   * @return the raw completion
   * @throws LlmServiceException when the model cannot be reached after retries
   */
  @Timed(value = "chat.completion", description = "Time for the chat model to answer")
  @Retry(name = "chat", fallbackMethod = "completeFallback")
  @CircuitBreaker(name = "chat")
  public String complete(String prompt) {
    String completion = researchTwinAgent.answer(ragConfig.getAgent().getPersona(), prompt);
    meterRegistry.counter("chat.requests.success").increment();
    return completion;
  }

  @SuppressWarnings("unused")
  private String completeFallback(String prompt, Throwable t) {
    log.error("Chat model call failed: {}", t.getMessage());
    meterRegistry.counter("chat.requests.failure").increment();
    throw new LlmServiceException("Chat model unavailable: " + t.getMessage(), t);
  }
}
