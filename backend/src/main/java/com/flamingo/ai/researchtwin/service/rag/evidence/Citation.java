package com.flamingo.ai.researchtwin.service.rag.evidence;

/** Citation shown alongside an answer. */
public record Citation(String title, String venue, String year) {}
