package com.flamingo.ai.researchtwin.config;

import com.flamingo.ai.researchtwin.agent.ResearchTwinAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  @Bean
  public ResearchTwinAgent researchTwinAgent(ChatModel chatModel) {
    return AiServices.builder(ResearchTwinAgent.class).chatModel(chatModel).build();
  }
}
