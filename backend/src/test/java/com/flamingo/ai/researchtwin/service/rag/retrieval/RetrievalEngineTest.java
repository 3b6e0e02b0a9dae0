package com.flamingo.ai.researchtwin.service.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.enums.RetrievalIntent;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.model.CorpusSnapshot;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.domain.model.RagDocument;
import com.flamingo.ai.researchtwin.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.researchtwin.service.rag.intent.IntentClassifier;
import com.flamingo.ai.researchtwin.service.rag.retrieval.strategy.MixedRoleStrategy;
import com.flamingo.ai.researchtwin.service.rag.retrieval.strategy.PaperCompareStrategy;
import com.flamingo.ai.researchtwin.service.rag.retrieval.strategy.PaperSpecificStrategy;
import com.flamingo.ai.researchtwin.service.rag.retrieval.strategy.UnfilteredStrategy;
import com.flamingo.ai.researchtwin.store.CorpusStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RetrievalEngine Tests")
class RetrievalEngineTest {

  @Mock private CorpusStore corpusStore;
  @Mock private EmbeddingService embeddingService;

  private SimpleMeterRegistry meterRegistry;
  private RetrievalEngine engine;

  private final RagDocument paperA =
      RetrievalFixtures.document("PaperA.pdf", SourceRole.PUBLICATION);
  private final RagDocument paperB =
      RetrievalFixtures.document("PaperB.pdf", SourceRole.PUBLICATION);
  private final RagDocument paperC =
      RetrievalFixtures.document("PaperC.pdf", SourceRole.PUBLICATION);
  private final RagDocument thesis = RetrievalFixtures.document("thesis.pdf", SourceRole.THESIS);

  @BeforeEach
  void setUp() {
    RagConfig config = new RagConfig();
    ChunkSearch chunkSearch = new ChunkSearch(config);
    meterRegistry = new SimpleMeterRegistry();
    engine =
        new RetrievalEngine(
            corpusStore,
            embeddingService,
            new IntentClassifier(),
            List.of(
                new PaperSpecificStrategy(chunkSearch, config),
                new PaperCompareStrategy(chunkSearch, config),
                new MixedRoleStrategy(chunkSearch, config),
                new UnfilteredStrategy(chunkSearch, config)),
            config,
            meterRegistry);
    lenient().when(embeddingService.embedQuery(anyString())).thenReturn(List.of());
  }

  @Nested
  @DisplayName("Paper-specific queries")
  class PaperSpecific {

    @Test
    @DisplayName("Should restrict evidence to the named paper")
    void shouldRestrictToNamedPaper() {
      givenCorpus();

      RetrievalResult result =
          engine.retrieveForQuery("ns", "What accuracy does PaperA report?", 5);

      assertThat(result.intent()).isEqualTo(RetrievalIntent.PAPER_SPECIFIC);
      assertThat(result.chunks()).isNotEmpty().hasSizeLessThanOrEqualTo(5);
      assertThat(result.chunks()).allMatch(chunk -> chunk.getDocumentId().equals(paperA.getId()));
      assertThat(result.targetDocumentNames()).containsExactly("PaperA.pdf");
      assertThat(result.notes()).containsExactly("paper_specific hard filter applied: PaperA.pdf");
    }

    @Test
    @DisplayName("Should return empty result instead of other papers when target has no chunks")
    void shouldNotSubstituteOtherPapers() {
      givenCorpus();

      RetrievalResult result =
          engine.retrieveForQuery("ns", "What accuracy does PaperC report?", 5);

      assertThat(result.intent()).isEqualTo(RetrievalIntent.PAPER_SPECIFIC);
      assertThat(result.chunks()).isEmpty();
      assertThat(result.notes())
          .containsExactly("paper_specific hard filter had no results for PaperC.pdf");
      assertThat(meterRegistry.find("rag.retrieval.fallback").counter()).isNull();
    }

    @Test
    @DisplayName("Should only use publication chunks of the target paper")
    void shouldOnlyUsePublicationChunks() {
      givenCorpus();

      RetrievalResult result = engine.retrieveForQuery("ns", "Results of PaperB?", 5);

      assertThat(result.chunks())
          .extracting(RagChunk::getSourceRole)
          .containsOnly(SourceRole.PUBLICATION);
    }
  }

  @Nested
  @DisplayName("Comparison queries")
  class Compare {

    @Test
    @DisplayName("Should represent each compared paper at most twice")
    void shouldRepresentEachComparedPaper() {
      givenCorpus();

      RetrievalResult result =
          engine.retrieveForQuery("ns", "Compare PaperA and PaperB on accuracy", 5);

      assertThat(result.intent()).isEqualTo(RetrievalIntent.PAPER_COMPARE);
      Map<String, Long> perDocument = countByDocument(result.chunks());
      assertThat(perDocument).containsOnlyKeys(paperA.getId(), paperB.getId());
      assertThat(perDocument.values()).allMatch(count -> count >= 1 && count <= 2);
      assertThat(result.notes())
          .containsExactly("paper_compare targeted papers: PaperA.pdf, PaperB.pdf");
    }

    @Test
    @DisplayName("Should fall back to role mix when compared papers have no chunks")
    void shouldFallBackWhenComparedPapersEmpty() {
      RagDocument paperD = RetrievalFixtures.document("PaperD.pdf", SourceRole.PUBLICATION);
      List<RagChunk> chunks = new ArrayList<>(RetrievalFixtures.chunks(paperA, 3));
      chunks.addAll(RetrievalFixtures.chunks(thesis, 2));
      when(corpusStore.read("ns"))
          .thenReturn(new CorpusSnapshot(List.of(paperA, paperC, paperD, thesis), chunks));

      RetrievalResult result = engine.retrieveForQuery("ns", "Compare PaperC and PaperD", 4);

      assertThat(result.intent()).isEqualTo(RetrievalIntent.PAPER_COMPARE);
      assertThat(result.chunks()).isNotEmpty();
      assertThat(result.notes().get(0)).startsWith("intent=paper_compare mix");
      assertThat(meterRegistry.counter("rag.retrieval.fallback", "rung", "mixed").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("Mixed and fallback retrieval")
  class Mixed {

    @Test
    @DisplayName("Should mix publication and thesis evidence for technical questions")
    void shouldMixRolesForTechnicalQuestions() {
      givenCorpus();

      RetrievalResult result =
          engine.retrieveForQuery("ns", "How does normalization help adaptation?", 5);

      assertThat(result.intent()).isEqualTo(RetrievalIntent.TECHNICAL_CROSS_PAPER);
      assertThat(result.chunks()).hasSize(5);
      assertThat(result.chunks())
          .extracting(RagChunk::getSourceRole)
          .contains(SourceRole.PUBLICATION, SourceRole.THESIS);
      assertThat(countByDocument(result.chunks()).values()).allMatch(count -> count <= 2);
      assertThat(result.chunks()).noneMatch(RagChunk::isRedundant);
      assertThat(result.notes())
          .containsExactly("intent=technical_cross_paper mix publication=4 thesis=1 topK=5");
    }

    @Test
    @DisplayName("Should lead with thesis evidence for overview questions")
    void shouldLeadWithThesisForOverview() {
      givenCorpus();

      RetrievalResult result =
          engine.retrieveForQuery("ns", "What is the big picture of your research?", 5);

      assertThat(result.intent()).isEqualTo(RetrievalIntent.RESEARCH_OVERVIEW);
      assertThat(result.chunks().get(0).getSourceRole()).isEqualTo(SourceRole.THESIS);
    }

    @Test
    @DisplayName("Should fall back to unfiltered search when no role has content")
    void shouldFallBackToUnfiltered() {
      RagDocument page = RetrievalFixtures.document("lab_page.txt", SourceRole.WEB);
      when(corpusStore.read("ns"))
          .thenReturn(new CorpusSnapshot(List.of(page), RetrievalFixtures.chunks(page, 3)));

      RetrievalResult result = engine.retrieveForQuery("ns", "normalization", 5);

      assertThat(result.chunks()).hasSize(2);
      assertThat(result.notes())
          .containsExactly("intent=technical_cross_paper fallback=unfiltered");
      assertThat(meterRegistry.counter("rag.retrieval.fallback", "rung", "unfiltered").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return empty result for empty namespace without embedding the query")
    void shouldHandleEmptyNamespace() {
      when(corpusStore.read("ns")).thenReturn(CorpusSnapshot.empty());

      RetrievalResult result = engine.retrieveForQuery("ns", "anything", 5);

      assertThat(result.isEmpty()).isTrue();
      verify(embeddingService, never()).embedQuery(anyString());
    }

    @Test
    @DisplayName("Should use the default top-k for non-positive values")
    void shouldUseDefaultTopK() {
      givenCorpus();

      RetrievalResult result =
          engine.retrieve(
              "ns", "normalization", RetrievalIntent.TECHNICAL_CROSS_PAPER, List.of(), 0);

      assertThat(result.chunks()).hasSize(5);
    }
  }

  @Test
  @DisplayName("Should rank by query embedding when available")
  void shouldRankByQueryEmbedding() {
    RagChunk best = RetrievalFixtures.chunk(paperA, 0, "unrelated");
    best.setEmbedding(List.of(1f, 0f));
    RagChunk worst = RetrievalFixtures.chunk(paperA, 1, "normalization");
    worst.setEmbedding(List.of(0f, 1f));
    when(corpusStore.read("ns"))
        .thenReturn(new CorpusSnapshot(List.of(paperA), List.of(worst, best)));
    when(embeddingService.embedQuery("normalization")).thenReturn(List.of(1f, 0f));

    RetrievalResult result = engine.retrieveForQuery("ns", "normalization", 2);

    assertThat(result.chunks()).containsExactly(best, worst);
  }

  private void givenCorpus() {
    List<RagChunk> chunks = new ArrayList<>();
    chunks.addAll(RetrievalFixtures.chunks(paperA, 3));
    chunks.addAll(RetrievalFixtures.chunks(paperB, 3));
    List<RagChunk> thesisChunks = RetrievalFixtures.chunks(thesis, 3);
    thesisChunks.get(0).markRedundant(chunks.get(0).getId(), 1.0);
    chunks.addAll(thesisChunks);
    when(corpusStore.read("ns"))
        .thenReturn(new CorpusSnapshot(List.of(paperA, paperB, paperC, thesis), chunks));
  }

  private static Map<String, Long> countByDocument(List<RagChunk> chunks) {
    return chunks.stream()
        .collect(Collectors.groupingBy(RagChunk::getDocumentId, Collectors.counting()));
  }
}
