package com.flamingo.ai.researchtwin.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * Serializes writers per namespace so read-modify-write cycles on a snapshot never interleave.
 * Locks are keyed by the namespace's store file stem, so ids sharing a file share a lock.
 */
@Component
public class NamespaceLocks {

  private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

  /**
   * Runs the action while holding the namespace's write lock.
   *
   * @param namespaceId the namespace to lock
   * @param action the read-modify-write work
   * @return the action's result
   */
  public <T> T withLock(String namespaceId, Supplier<T> action) {
    ReentrantLock lock =
        locks.computeIfAbsent(NamespaceFileNames.stem(namespaceId), stem -> new ReentrantLock());
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
