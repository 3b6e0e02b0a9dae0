package com.flamingo.ai.researchtwin.service.rag.evidence;

import com.flamingo.ai.researchtwin.domain.enums.EvidenceLabel;
import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalResult;
import com.flamingo.ai.researchtwin.service.rag.similarity.TextKeys;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Binds a model answer to the evidence it was given.
 *
 * <p>Self-written evidence sections and markers that match no reference are removed, compliance
 * notes are derived from the reference mix, a primary evidence line is added when the answer cites
 * nothing, and the full evidence listing is appended. Never throws; missing inputs produce an
 * answer without markers or notes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvidenceContractEnforcer {

  static final String PRIMARY_EVIDENCE_PREFIX = "Primary evidence: ";
  static final String NOTES_HEADER = "### Evidence Notes";
  static final String EVIDENCE_HEADER = "### Evidence";
  static final int MAX_PRIMARY_MARKERS = 4;
  static final int MAX_CITATIONS = 8;

  static final String NOTE_PAPER_RESTRICTED = "Evidence is restricted to the target paper: %s.";
  static final String NOTE_TARGET_QUANT_MISSING =
      "Requested quantitative result was not found in retrieved context from the target paper.";
  static final String NOTE_QUANT_MISSING =
      "Publication-backed quantitative evidence was not found in current retrieved context.";
  static final String NOTE_REDUNDANT_ONLY =
      "Only thesis-redundant evidence was available for some claims; treat those claims as lower"
          + " confidence.";
  static final String NOTE_PUBLICATION_CANONICAL =
      "When thesis framing differs from paper wording, publication evidence is treated as"
          + " canonical for factual details.";

  private static final List<String> SECTION_HEADERS =
      List.of(
          "\nPrimary evidence:",
          "\n### Evidence Notes",
          "\n### Evidence",
          "\nEvidence Notes\n",
          "\nEvidence\n",
          "\nCitations\n",
          "\nReferences\n");

  private static final Pattern MARKER = Pattern.compile("\\[(TR\\d+|P\\d+|T\\d+|W\\d+|S\\d+)\\]");
  private static final Pattern QUANTITY =
      Pattern.compile("\\b\\d+(\\.\\d+)?\\s*(%|percent|points|x)?\\b");

  static final List<String> QUANTITATIVE_TERMS =
      List.of(
          "result",
          "results",
          "metric",
          "metrics",
          "accuracy",
          "miou",
          "f1",
          "auc",
          "score",
          "gain",
          "improvement",
          "ablation",
          "table",
          "benchmark");

  private final MeterRegistry meterRegistry;

  /**
   * Enforces the citation contract on a model answer.
   *
   * @param query the user query
   * @param retrieval how the evidence was retrieved; may be {@code null}
   * @param answerText the model's answer text
   * @param references the references given to the model
   * @return the repaired answer and its citations
   */
  public ContractResult enforce(
      String query,
      RetrievalResult retrieval,
      String answerText,
      List<EvidenceReference> references) {
    List<EvidenceReference> refs = references == null ? List.of() : references;
    Set<String> validMarkers =
        refs.stream().map(EvidenceReference::marker).collect(Collectors.toSet());

    String text = stripEvidenceSections(answerText == null ? "" : answerText.trim());
    int stripped = countMarkers(text, marker -> !validMarkers.contains(marker));
    if (stripped > 0) {
      text = stripUnknownMarkers(text, validMarkers).trim();
      meterRegistry.counter("rag.evidence.markers.stripped").increment(stripped);
      log.debug("Stripped {} unknown citation markers", stripped);
    }

    List<String> notes = complianceNotes(query, retrieval, text, refs);

    boolean primaryAdded = false;
    if (!refs.isEmpty() && countMarkers(text, validMarkers::contains) == 0) {
      text = (text + "\n\n" + PRIMARY_EVIDENCE_PREFIX + primaryMarkers(refs)).trim();
      primaryAdded = true;
      meterRegistry.counter("rag.evidence.primary.synthesized").increment();
    }
    if (!notes.isEmpty()) {
      text = (text + "\n\n" + notesBlock(notes)).trim();
    }
    if (!refs.isEmpty()) {
      text = (text + "\n\n" + evidenceBlock(refs)).trim();
    }
    return new ContractResult(text, citations(refs), notes, stripped, primaryAdded);
  }

  /** Cuts the text at the earliest known evidence or citations section header. */
  static String stripEvidenceSections(String text) {
    int cut = -1;
    for (String header : SECTION_HEADERS) {
      int index = text.indexOf(header);
      if (index >= 0 && (cut < 0 || index < cut)) {
        cut = index;
      }
    }
    return cut < 0 ? text.trim() : text.substring(0, cut).trim();
  }

  static String stripUnknownMarkers(String text, Set<String> validMarkers) {
    Matcher matcher = MARKER.matcher(text);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String replacement =
          validMarkers.contains(matcher.group(1)) ? Matcher.quoteReplacement(matcher.group()) : "";
      matcher.appendReplacement(out, replacement);
    }
    matcher.appendTail(out);
    return out.toString();
  }

  /** Counts bracketed markers whose bare form satisfies the filter. */
  static int countMarkers(String text, Predicate<String> filter) {
    Matcher matcher = MARKER.matcher(text);
    int count = 0;
    while (matcher.find()) {
      if (filter.test(matcher.group(1))) {
        count++;
      }
    }
    return count;
  }

  static boolean hasQuantitativeSignals(String text) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    if (QUANTITY.matcher(text).find()) {
      return true;
    }
    String normalized = TextKeys.matchText(text);
    return QUANTITATIVE_TERMS.stream().anyMatch(normalized::contains);
  }

  private static List<String> complianceNotes(
      String query, RetrievalResult retrieval, String text, List<EvidenceReference> refs) {
    boolean hasPaper = hasLabel(refs, EvidenceLabel.PAPER);
    boolean hasThesis = hasLabel(refs, EvidenceLabel.THESIS);
    boolean hasRedundant = hasLabel(refs, EvidenceLabel.THESIS_REDUNDANT);
    boolean paperTargeted =
        retrieval != null
            && retrieval.intent() == RetrievalIntent.PAPER_SPECIFIC
            && !retrieval.targetDocumentNames().isEmpty();

    List<String> notes = new ArrayList<>();
    if (paperTargeted) {
      notes.add(String.format(NOTE_PAPER_RESTRICTED, retrieval.targetDocumentNames().get(0)));
    }
    if ((hasQuantitativeSignals(query) || hasQuantitativeSignals(text)) && !hasPaper) {
      notes.add(paperTargeted ? NOTE_TARGET_QUANT_MISSING : NOTE_QUANT_MISSING);
    }
    if (hasRedundant && !hasPaper) {
      notes.add(NOTE_REDUNDANT_ONLY);
    }
    if (hasPaper && (hasThesis || hasRedundant)) {
      notes.add(NOTE_PUBLICATION_CANONICAL);
    }
    return notes;
  }

  /** Up to four markers, publication first, then thesis, thesis-redundant, web and other. */
  static String primaryMarkers(List<EvidenceReference> refs) {
    return Stream.of(
            EvidenceLabel.PAPER,
            EvidenceLabel.THESIS,
            EvidenceLabel.THESIS_REDUNDANT,
            EvidenceLabel.WEB,
            EvidenceLabel.SOURCE)
        .flatMap(label -> refs.stream().filter(ref -> ref.label() == label))
        .limit(MAX_PRIMARY_MARKERS)
        .map(EvidenceReference::bracketed)
        .collect(Collectors.joining(" "));
  }

  static String notesBlock(List<String> notes) {
    return NOTES_HEADER
        + "\n"
        + notes.stream().map(note -> "- " + note).collect(Collectors.joining("\n"));
  }

  static String evidenceBlock(List<EvidenceReference> refs) {
    return EVIDENCE_HEADER
        + "\n"
        + refs.stream()
            .map(
                ref ->
                    String.format(
                        "- %s %s | %s | venue: %s | year: %s | chunk: %s",
                        ref.bracketed(),
                        ref.label().getDisplay(),
                        ref.title(),
                        ref.venue(),
                        ref.year(),
                        ref.chunkId()))
            .collect(Collectors.joining("\n"));
  }

  /** Distinct by label, title, year and venue; at most eight. */
  static List<Citation> citations(List<EvidenceReference> refs) {
    Set<String> seen = new LinkedHashSet<>();
    List<Citation> citations = new ArrayList<>();
    for (EvidenceReference ref : refs) {
      String key =
          ref.label().getDisplay() + "::" + ref.title() + "::" + ref.year() + "::" + ref.venue();
      if (!seen.add(key)) {
        continue;
      }
      citations.add(new Citation(ref.title(), ref.venue(), ref.year()));
      if (citations.size() >= MAX_CITATIONS) {
        break;
      }
    }
    return citations;
  }

  private static boolean hasLabel(List<EvidenceReference> refs, EvidenceLabel label) {
    return refs.stream().anyMatch(ref -> ref.label() == label);
  }
}
