package com.flamingo.ai.researchtwin.service.rag.redundancy;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import com.flamingo.ai.researchtwin.service.rag.similarity.TextKeys;
import com.flamingo.ai.researchtwin.service.rag.similarity.TextSimilarity;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Marks thesis chunks that repeat publication chunks without adding material content.
 *
 * <p>Annotation is recomputed wholesale over a namespace's chunks every time the corpus changes:
 * each thesis chunk is reset, then checked for an exact content-hash match (which always takes
 * precedence) and otherwise for a near-duplicate that passes both the lexical and the embedding
 * threshold. Chunks without an embedding can only match exactly. Either kind of match only counts
 * when the thesis chunk's novel-sentence ratio stays below the configured threshold. Running it
 * twice over the same chunks yields the same flags.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedundancyAnnotator {

  /** Score assigned to exact content-hash matches. */
  public static final double EXACT_MATCH_SCORE = 1.0;

  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Annotates the thesis chunks of one namespace in place.
   *
   * @param chunks every chunk of the namespace
   * @param namespaceId namespace the chunks belong to, for logging
   * @return number of thesis chunks marked redundant
   */
  public int annotate(List<RagChunk> chunks, String namespaceId) {
    List<RagChunk> publicationChunks = new ArrayList<>();
    List<RagChunk> thesisChunks = new ArrayList<>();
    for (RagChunk chunk : chunks) {
      if (chunk.getSourceRole() == SourceRole.PUBLICATION) {
        publicationChunks.add(chunk);
      } else if (chunk.getSourceRole() == SourceRole.THESIS) {
        thesisChunks.add(chunk);
      }
    }
    if (thesisChunks.isEmpty()) {
      return 0;
    }

    Map<String, RagChunk> publicationByHash = new LinkedHashMap<>();
    for (RagChunk publication : publicationChunks) {
      publicationByHash.putIfAbsent(hashOf(publication), publication);
    }

    RagConfig.Dedup dedup = ragConfig.getDedup();
    int marked = 0;
    for (RagChunk thesis : thesisChunks) {
      thesis.clearRedundancy();
      if (publicationChunks.isEmpty()) {
        continue;
      }

      RagChunk exactMatch = publicationByHash.get(hashOf(thesis));
      if (exactMatch != null) {
        if (isNotNovel(thesis, exactMatch, dedup)) {
          thesis.markRedundant(exactMatch.getId(), EXACT_MATCH_SCORE);
          marked++;
        }
        continue;
      }

      NearDuplicate best = findNearDuplicate(thesis, publicationChunks, dedup);
      if (best != null && isNotNovel(thesis, best.publication(), dedup)) {
        thesis.markRedundant(best.publication().getId(), best.score());
        marked++;
      }
    }

    meterRegistry.counter("rag.redundancy.marked").increment(marked);
    log.info(
        "Redundancy pass for namespace {}: {} of {} thesis chunks redundant against {} publication"
            + " chunks",
        namespaceId,
        marked,
        thesisChunks.size(),
        publicationChunks.size());
    return marked;
  }

  /**
   * Finds the publication chunk with the highest average of cosine and lexical similarity among
   * those passing both thresholds. Publication chunks without an embedding never match.
   */
  private static NearDuplicate findNearDuplicate(
      RagChunk thesis, List<RagChunk> publicationChunks, RagConfig.Dedup dedup) {
    if (!thesis.hasEmbedding()) {
      return null;
    }
    NearDuplicate best = null;
    for (RagChunk publication : publicationChunks) {
      if (!publication.hasEmbedding()) {
        continue;
      }
      double cosine = TextSimilarity.cosine(thesis.getEmbedding(), publication.getEmbedding());
      if (cosine < dedup.getCosineThreshold()) {
        continue;
      }
      double lexical = TextSimilarity.lexicalOverlap(thesis.getText(), publication.getText());
      if (lexical < dedup.getLexicalThreshold()) {
        continue;
      }
      double combined = (cosine + lexical) / 2;
      if (best == null || combined > best.score()) {
        best = new NearDuplicate(publication, combined);
      }
    }
    return best;
  }

  private static boolean isNotNovel(RagChunk thesis, RagChunk publication, RagConfig.Dedup dedup) {
    double novelty = TextSimilarity.novelSentenceRatio(thesis.getText(), publication.getText());
    return novelty < dedup.getNovelSentenceThreshold();
  }

  private static String hashOf(RagChunk chunk) {
    if (chunk.getTextHash() == null) {
      chunk.setTextHash(TextKeys.textHash(chunk.getText()));
    }
    return chunk.getTextHash();
  }

  private record NearDuplicate(RagChunk publication, double score) {}
}
