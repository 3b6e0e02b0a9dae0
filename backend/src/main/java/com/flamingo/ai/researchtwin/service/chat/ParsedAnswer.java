package com.flamingo.ai.researchtwin.service.chat;

import java.util.List;

/** Answer text and follow-ups extracted from a model completion. */
public record ParsedAnswer(String responseText, List<String> suggestedFollowups) {}
