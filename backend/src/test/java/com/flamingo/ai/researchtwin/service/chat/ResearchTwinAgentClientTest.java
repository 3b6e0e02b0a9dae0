package com.flamingo.ai.researchtwin.service.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.flamingo.ai.researchtwin.agent.ResearchTwinAgent;
import com.flamingo.ai.researchtwin.config.RagConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResearchTwinAgentClient Tests")
class ResearchTwinAgentClientTest {

  @Mock private ResearchTwinAgent researchTwinAgent;

  private SimpleMeterRegistry meterRegistry;
  private ResearchTwinAgentClient client;

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    ragConfig.getAgent().setPersona("Dr. Rao");
    meterRegistry = new SimpleMeterRegistry();
    client = new ResearchTwinAgentClient(researchTwinAgent, ragConfig, meterRegistry);
  }

  @Test
  @DisplayName("Should pass the persona and count successful completions")
  void shouldCompleteWithPersona() {
    when(researchTwinAgent.answer("Dr. Rao", "prompt")).thenReturn("{\"response_text\":\"hi\"}");

    assertThat(client.complete("prompt")).isEqualTo("{\"response_text\":\"hi\"}");
    assertThat(meterRegistry.counter("chat.requests.success").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should let model errors reach the resilience layer")
  void shouldPropagateModelErrors() {
    when(researchTwinAgent.answer("Dr. Rao", "prompt"))
        .thenThrow(new IllegalStateException("rate limited"));

    assertThatThrownBy(() -> client.complete("prompt"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("rate limited");
    assertThat(meterRegistry.counter("chat.requests.success").count()).isZero();
  }
}
