package com.flamingo.ai.researchtwin.store;

import com.flamingo.ai.researchtwin.domain.model.CorpusSnapshot;

/**
 * Durable whole-snapshot storage of documents and chunks, partitioned by namespace.
 *
 * <p>Reads return normalized records only; malformed entries are dropped. Writes replace the
 * namespace's snapshot atomically. Callers that read-modify-write must hold the namespace's lock
 * from {@link NamespaceLocks}.
 */
public interface CorpusStore {

  /**
   * Reads the namespace snapshot.
   *
   * @param namespaceId the corpus namespace
   * @return the normalized snapshot, empty when nothing is stored yet
   */
  CorpusSnapshot read(String namespaceId);

  /**
   * Persists the full namespace snapshot, replacing what was stored.
   *
   * @param namespaceId the corpus namespace
   * @param snapshot documents and chunks to store
   * @throws com.flamingo.ai.researchtwin.exception.CorpusStoreException if the write fails
   */
  void writeAll(String namespaceId, CorpusSnapshot snapshot);
}
