package com.flamingo.ai.researchtwin.service.rag.evidence;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.researchtwin.domain.enums.EvidenceLabel;
import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.service.rag.retrieval.RetrievalResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("EvidenceContractEnforcer Tests")
class EvidenceContractEnforcerTest {

  private static final EvidenceReference PAPER =
      new EvidenceReference("P1", EvidenceLabel.PAPER, "dss.pdf", "DSS", "ICCVW", "2023", "c1");
  private static final EvidenceReference THESIS =
      new EvidenceReference("T1", EvidenceLabel.THESIS, "thesis.pdf", "Thesis", "N/A", "N/A", "c2");
  private static final EvidenceReference REDUNDANT =
      new EvidenceReference(
          "TR1", EvidenceLabel.THESIS_REDUNDANT, "thesis.pdf", "Thesis", "N/A", "N/A", "c3");

  private SimpleMeterRegistry meterRegistry;
  private EvidenceContractEnforcer enforcer;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    enforcer = new EvidenceContractEnforcer(meterRegistry);
  }

  @Nested
  @DisplayName("Marker hygiene")
  class MarkerHygiene {

    @Test
    @DisplayName("Should strip markers that match no reference")
    void shouldStripUnknownMarkers() {
      ContractResult result =
          enforcer.enforce(
              "How does it work?", null, "It adapts online [P1][P99] quickly.", List.of(PAPER));

      assertThat(result.responseText()).startsWith("It adapts online [P1] quickly.");
      assertThat(result.responseText()).doesNotContain("[P99]");
      assertThat(result.strippedMarkers()).isEqualTo(1);
      assertThat(result.primaryEvidenceAdded()).isFalse();
      assertThat(meterRegistry.counter("rag.evidence.markers.stripped").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should drop self-written evidence sections")
    void shouldDropSelfWrittenSections() {
      String answer = "Main answer [P1].\n### Evidence\n- [P7] made up source\n\nReferences\nx";

      ContractResult result = enforcer.enforce("q", null, answer, List.of(PAPER));

      assertThat(result.responseText()).doesNotContain("[P7]").doesNotContain("made up");
      assertThat(result.responseText()).startsWith("Main answer [P1].\n\n### Evidence\n");
    }

    @Test
    @DisplayName("Should add primary evidence line when the answer cites nothing")
    void shouldAddPrimaryEvidenceLine() {
      ContractResult result =
          enforcer.enforce("q", null, "An answer without markers.", List.of(THESIS, PAPER));

      assertThat(result.primaryEvidenceAdded()).isTrue();
      assertThat(result.responseText())
          .startsWith("An answer without markers.\n\nPrimary evidence: [P1] [T1]");
      assertThat(meterRegistry.counter("rag.evidence.primary.synthesized").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should limit primary evidence to four markers")
    void shouldLimitPrimaryMarkers() {
      List<EvidenceReference> refs = new ArrayList<>();
      for (int i = 1; i <= 6; i++) {
        refs.add(
            new EvidenceReference(
                "P" + i, EvidenceLabel.PAPER, "p.pdf", "Paper " + i, "V", "2020", "c" + i));
      }

      assertThat(EvidenceContractEnforcer.primaryMarkers(refs)).isEqualTo("[P1] [P2] [P3] [P4]");
    }
  }

  @Nested
  @DisplayName("Compliance notes")
  class ComplianceNotes {

    @Test
    @DisplayName("Should note the target paper and missing quantitative evidence")
    void shouldNoteTargetPaperRestriction() {
      RetrievalResult retrieval =
          new RetrievalResult(
              RetrievalIntent.PAPER_SPECIFIC, List.of(), List.of(), List.of("dss.pdf"), List.of());

      ContractResult result =
          enforcer.enforce("What accuracy did DSS reach?", retrieval, "Not found.", List.of());

      assertThat(result.complianceNotes())
          .containsExactly(
              "Evidence is restricted to the target paper: dss.pdf.",
              EvidenceContractEnforcer.NOTE_TARGET_QUANT_MISSING);
      assertThat(result.responseText())
          .isEqualTo(
              "Not found.\n\n### Evidence Notes\n"
                  + "- Evidence is restricted to the target paper: dss.pdf.\n"
                  + "- "
                  + EvidenceContractEnforcer.NOTE_TARGET_QUANT_MISSING);
      assertThat(result.citations()).isEmpty();
    }

    @Test
    @DisplayName("Should flag thesis-redundant-only support")
    void shouldFlagRedundantOnlySupport() {
      ContractResult result =
          enforcer.enforce("Explain it", null, "Yes [TR1].", List.of(REDUNDANT));

      assertThat(result.complianceNotes())
          .containsExactly(EvidenceContractEnforcer.NOTE_REDUNDANT_ONLY);
    }

    @Test
    @DisplayName("Should flag quantitative answers without publication evidence")
    void shouldFlagQuantWithoutPublication() {
      ContractResult result =
          enforcer.enforce("Explain it", null, "It improves by 4.2 points [T1].", List.of(THESIS));

      assertThat(result.complianceNotes())
          .containsExactly(EvidenceContractEnforcer.NOTE_QUANT_MISSING);
    }

    @Test
    @DisplayName("Should state publication precedence when both roles are cited")
    void shouldStatePublicationPrecedence() {
      ContractResult result =
          enforcer.enforce("Explain it", null, "Answer [P1] [T1].", List.of(PAPER, THESIS));

      assertThat(result.complianceNotes())
          .containsExactly(EvidenceContractEnforcer.NOTE_PUBLICATION_CANONICAL);
      assertThat(result.responseText())
          .endsWith(
              "### Evidence\n"
                  + "- [P1] PAPER | DSS | venue: ICCVW | year: 2023 | chunk: c1\n"
                  + "- [T1] THESIS | Thesis | venue: N/A | year: N/A | chunk: c2");
    }
  }

  @Test
  @DisplayName("Should build distinct citations capped at eight")
  void shouldBuildDistinctCitations() {
    List<EvidenceReference> refs = new ArrayList<>(List.of(PAPER, PAPER, THESIS, REDUNDANT));
    for (int i = 0; i < 10; i++) {
      refs.add(
          new EvidenceReference(
              "W" + i, EvidenceLabel.WEB, "w.txt", "Page " + i, "WEB", "N/A", "w" + i));
    }

    List<Citation> citations = EvidenceContractEnforcer.citations(refs);

    assertThat(citations).hasSize(8);
    assertThat(citations.get(0)).isEqualTo(new Citation("DSS", "ICCVW", "2023"));
    assertThat(citations.get(1)).isEqualTo(new Citation("Thesis", "N/A", "N/A"));
    assertThat(citations.get(2)).isEqualTo(new Citation("Thesis", "N/A", "N/A"));
  }

  @Test
  @DisplayName("Should tolerate missing answer and references")
  void shouldTolerateMissingInputs() {
    ContractResult result = enforcer.enforce("hello", null, null, null);

    assertThat(result.responseText()).isEmpty();
    assertThat(result.citations()).isEmpty();
    assertThat(result.complianceNotes()).isEmpty();
  }
}
