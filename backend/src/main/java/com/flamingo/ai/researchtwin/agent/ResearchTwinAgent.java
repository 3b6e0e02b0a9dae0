package com.flamingo.ai.researchtwin.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent answering research questions from a composed evidence prompt. Uses LangChain4j AI
 * Services; the reply is the raw completion, expected to be a JSON object.
 */
public interface ResearchTwinAgent {

  @SystemMessage(
      """
        You are {{persona}}'s Research Digital Twin. Follow role, goal, and instructions exactly.
        Return only valid JSON with keys response_text, citations, suggested_followups.
        """)
  @UserMessage("{{prompt}}")
  String answer(@V("persona") String persona, @V("prompt") String prompt);
}
