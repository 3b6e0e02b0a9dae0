package com.flamingo.ai.researchtwin.service.rag.retrieval;

import com.flamingo.ai.researchtwin.domain.model.RagChunk;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * List operations that keep an evidence set varied across source documents. All of them preserve
 * the relative order of their input.
 */
public final class DiversityCap {

  private DiversityCap() {}

  /**
   * Keeps at most {@code maxPerDocument} chunks per document, dropping later ones.
   *
   * @param chunks ranked chunks
   * @param maxPerDocument cap per {@code documentId}; zero or less returns the input unchanged
   * @return capped chunks in input order
   */
  public static List<RagChunk> cap(List<RagChunk> chunks, int maxPerDocument) {
    if (maxPerDocument <= 0) {
      return chunks;
    }
    Map<String, Integer> taken = new HashMap<>();
    List<RagChunk> result = new ArrayList<>();
    for (RagChunk chunk : chunks) {
      int count = taken.getOrDefault(chunk.getDocumentId(), 0);
      if (count >= maxPerDocument) {
        continue;
      }
      result.add(chunk);
      taken.put(chunk.getDocumentId(), count + 1);
    }
    return result;
  }

  /** Drops repeated chunk ids, keeping the first occurrence. */
  public static List<RagChunk> mergeUnique(List<RagChunk> chunks) {
    Set<String> seen = new HashSet<>();
    List<RagChunk> result = new ArrayList<>();
    for (RagChunk chunk : chunks) {
      if (seen.add(chunk.getId())) {
        result.add(chunk);
      }
    }
    return result;
  }

  /**
   * Alternates one chunk from each list, starting with {@code primary}, until {@code limit}
   * chunks are taken or both lists are exhausted.
   */
  public static List<RagChunk> interleave(
      List<RagChunk> primary, List<RagChunk> secondary, int limit) {
    List<RagChunk> result = new ArrayList<>();
    Iterator<RagChunk> first = primary.iterator();
    Iterator<RagChunk> second = secondary.iterator();
    while (result.size() < limit && (first.hasNext() || second.hasNext())) {
      if (first.hasNext()) {
        result.add(first.next());
      }
      if (result.size() >= limit) {
        break;
      }
      if (second.hasNext()) {
        result.add(second.next());
      }
    }
    return result;
  }

  /**
   * Calculates a diversity score for a set of chunks.
   *
   * @param chunks the chunks to evaluate
   * @return score between 0.0 (all from one document) and 1.0 (one per document)
   */
  public static double diversityScore(List<RagChunk> chunks) {
    if (chunks == null || chunks.isEmpty()) {
      return 0.0;
    }
    long uniqueDocuments = chunks.stream().map(RagChunk::getDocumentId).distinct().count();
    return (double) uniqueDocuments / chunks.size();
  }
}
