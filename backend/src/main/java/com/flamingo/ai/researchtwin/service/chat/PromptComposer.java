package com.flamingo.ai.researchtwin.service.chat;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.service.rag.evidence.EvidenceReference;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalResult;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds the user prompt for the research twin agent from retrieved evidence. */
@Component
@RequiredArgsConstructor
public class PromptComposer {

  static final String NO_CONTEXT = "No RAG context available.";
  static final String NO_HINTS = "No citation hints available.";
  static final String NO_POLICY = "No special policy.";
  static final String NO_NOTES = "No retrieval notes.";

  private static final String GOAL =
      "Engage visitors in peer-to-peer academic conversations about %s's research. Answer"
          + " questions about methodologies, suggest related papers, explain technical concepts,"
          + " and provide collaboration context using the knowledge base of papers and website"
          + " content.";

  private static final String INSTRUCTIONS =
      """
      You speak as %s in first person ('my research', 'I published', 'my approach'). \
      You maintain an academic peer-to-peer tone: technically precise yet approachable.

      Core behaviors:
      1. ALWAYS ground responses in retrieved knowledge context and never fabricate paper details.
      2. For paper-specific questions, stay strictly within the named paper(s). If evidence is \
      missing, say it is not found in the retrieved context.
      3. For quantitative or experimental claims, prioritize publication evidence and avoid \
      thesis-only support when publication evidence exists.
      4. Use thesis context for synthesis: motivation, research trajectory, and future directions.
      5. If asked to compare methods from different problem settings, clarify that they are not \
      directly experimentally comparable and provide conceptual differences only.
      6. If a question is outside current knowledge context, state limits clearly and provide \
      only high-level perspective.
      7. Keep responses concise but substantive. Prefer a direct answer first, then supporting \
      detail.

      Citation and formatting contract:
      1. Use inline evidence markers in the main answer text, such as [P1], [T1], [TR1].
      2. Respect marker meaning: [P#] publication, [T#] thesis, [TR#] thesis-redundant.
      3. Do not write your own evidence or references section; it is appended for you.
      4. Never output chain-of-thought, hidden reasoning, <think> tags or scratch work.
      5. Never embed another JSON object inside response_text.

      Return ONLY a JSON object with this exact structure:
      {"response_text":"string","citations":[{"title":"string","venue":"string","year":"string"}],\
      "suggested_followups":["string"]}""";

  static final List<String> CITATION_CONTRACT =
      List.of(
          "Use inline evidence markers such as [P1], [T1], [TR1] directly on substantive claims.",
          "For quantitative claims, cite publication evidence ([P#]) when available.",
          "Do not rely on [TR#] as sole support for key claims when [P#] exists.",
          "Keep paper-specific answers constrained to the target paper context only.");

  private final RagConfig ragConfig;

  /**
   * Composes the prompt.
   *
   * @param question the user question
   * @param retrieval the retrieved evidence and how it was selected
   * @param references citation markers bound to the retrieved chunks
   * @return the prompt text
   */
  public String compose(
      String question, RetrievalResult retrieval, List<EvidenceReference> references) {
    String persona = ragConfig.getAgent().getPersona();
    List<String> sections = new ArrayList<>();
    sections.add(section("Role", role(persona)));
    sections.add(section("Goal", String.format(GOAL, persona)));
    sections.add(section("Instructions", String.format(INSTRUCTIONS, persona)));
    sections.add(section("Detected query intent", retrieval.intent().getValue()));
    List<String> policy = intentPolicy(retrieval.intent(), retrieval.targetDocumentNames());
    sections.add(section("Intent-specific evidence policy", numbered(policy, NO_POLICY)));
    sections.add(section("Citation contract", numbered(CITATION_CONTRACT, NO_POLICY)));
    sections.add(section("Retrieval notes", bulleted(retrieval.notes(), NO_NOTES)));
    sections.add(section("User question", question));
    sections.add(section("Knowledge context", context(retrieval.chunks())));
    sections.add(section("Citation hints to prefer (if relevant)", citationHints(references)));
    return String.join("\n\n", sections);
  }

  /** Policy lines for an intent; the first line applies to every intent. */
  static List<String> intentPolicy(RetrievalIntent intent, List<String> targets) {
    List<String> lines = new ArrayList<>();
    lines.add(
        "Never make key factual claims based only on THESIS-REDUNDANT evidence when PAPER"
            + " evidence exists.");
    String targetList = targets == null ? "" : String.join(", ", targets);
    switch (intent) {
      case PAPER_SPECIFIC -> {
        lines.add(
            targetList.isEmpty()
                ? "Treat this as a single-paper query and avoid cross-paper numerical claims."
                : "Treat this as a single-paper query. Keep evidence restricted to: "
                    + targetList
                    + ".");
        lines.add(
            "If the requested metric/result is not present in that paper, explicitly state that"
                + " it was not found.");
      }
      case PAPER_COMPARE -> {
        if (!targetList.isEmpty()) {
          lines.add("Focus comparison on these papers only: " + targetList + ".");
        }
        lines.add("For each compared claim, attribute evidence to the specific paper.");
      }
      case TECHNICAL_CROSS_PAPER ->
          lines.add(
              "Prioritize publication evidence for technical and quantitative claims; use thesis"
                  + " only as supporting context.");
      case RESEARCH_OVERVIEW ->
          lines.add(
              "Use thesis to structure the narrative, but include publication evidence for"
                  + " concrete technical claims.");
      case FUTURE_DIRECTIONS ->
          lines.add(
              "Use thesis for future-work framing while grounding key claims in publication"
                  + " evidence when available.");
      default -> {}
    }
    return lines;
  }

  String citationHints(List<EvidenceReference> references) {
    if (references == null || references.isEmpty()) {
      return NO_HINTS;
    }
    return references.stream()
        .limit(Math.max(0, ragConfig.getAgent().getMaxCitationHints()))
        .map(ref -> "- " + ref.bracketed() + " " + ref.label().getDisplay() + " | " + ref.title())
        .collect(Collectors.joining("\n"));
  }

  private static String role(String persona) {
    return "You are "
        + persona
        + "'s digital twin, a conversational, technically fluent research peer. You represent "
        + persona
        + "'s academic identity, research expertise, and scholarly perspective.";
  }

  private static String context(List<RagChunk> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      return NO_CONTEXT;
    }
    return IntStream.range(0, chunks.size())
        .mapToObj(i -> "[Context " + (i + 1) + "] " + chunks.get(i).getText())
        .collect(Collectors.joining("\n\n"));
  }

  private static String numbered(List<String> lines, String empty) {
    if (lines == null || lines.isEmpty()) {
      return empty;
    }
    return IntStream.range(0, lines.size())
        .mapToObj(i -> (i + 1) + ". " + lines.get(i))
        .collect(Collectors.joining("\n"));
  }

  private static String bulleted(List<String> lines, String empty) {
    if (lines == null || lines.isEmpty()) {
      return empty;
    }
    return lines.stream().map(line -> "- " + line).collect(Collectors.joining("\n"));
  }

  private static String section(String title, String body) {
    return title + ":\n" + body;
  }
}
