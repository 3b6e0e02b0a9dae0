package com.flamingo.ai.researchtwin.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.model.CorpusSnapshot;
import com.flamingo.ai.researchtwin.exception.CorpusStoreException;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

/**
 * {@link CorpusStore} backed by one pretty-printed JSON file per namespace.
 *
 * <p>Writes go to a temporary sibling file which is then moved over the target, so readers see
 * either the previous or the new snapshot and never a partial one. Unreadable files degrade to an
 * empty snapshot with a warning. Records stored under another namespace id are never returned.
 */
@Repository
@Slf4j
public class JsonFileCorpusStore implements CorpusStore {

  private static final long RETRY_DELAY_MS = 50;

  private final ObjectMapper objectMapper;
  private final Path basePath;
  private final int writeRetries;

  public JsonFileCorpusStore(ObjectMapper objectMapper, RagConfig ragConfig) {
    this.objectMapper =
        objectMapper
            .copy()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    this.basePath = Paths.get(ragConfig.getStorage().getBasePath());
    this.writeRetries = Math.max(1, ragConfig.getStorage().getWriteRetries());
  }

  @Override
  @Timed(value = "rag.store.read", description = "Time to read a namespace snapshot")
  public CorpusSnapshot read(String namespaceId) {
    Path file = fileFor(namespaceId);
    try {
      JsonNode root = objectMapper.readTree(file.toFile());
      CorpusSnapshot snapshot = CorpusRecordNormalizer.normalize(root);
      int foreign = retainNamespace(snapshot, namespaceId);
      if (foreign > 0) {
        log.warn("Ignored {} records of other namespaces in {}", foreign, file);
      }
      log.debug(
          "Read namespace {}: {} documents, {} chunks",
          namespaceId,
          snapshot.documents().size(),
          snapshot.chunks().size());
      return snapshot;
    } catch (NoSuchFileException e) {
      return CorpusSnapshot.empty();
    } catch (IOException e) {
      if (!Files.exists(file)) {
        return CorpusSnapshot.empty();
      }
      log.warn("Unreadable store file {}, using empty snapshot: {}", file, e.getMessage());
      return CorpusSnapshot.empty();
    }
  }

  @Override
  @Timed(value = "rag.store.write", description = "Time to persist a namespace snapshot")
  public void writeAll(String namespaceId, CorpusSnapshot snapshot) {
    Path target = fileFor(namespaceId);
    byte[] payload;
    try {
      payload =
          objectMapper.writeValueAsBytes(
              Map.of("documents", snapshot.documents(), "chunks", snapshot.chunks()));
    } catch (IOException e) {
      throw new CorpusStoreException(namespaceId, "Failed to serialize snapshot", e);
    }

    for (int attempt = 1; ; attempt++) {
      Path temp = target.resolveSibling(target.getFileName() + "." + System.nanoTime() + ".tmp");
      try {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Files.write(temp, payload);
        moveIntoPlace(temp, target);
        log.debug(
            "Persisted namespace {} ({} documents, {} chunks) to {}",
            namespaceId,
            snapshot.documents().size(),
            snapshot.chunks().size(),
            target);
        return;
      } catch (IOException e) {
        deleteQuietly(temp);
        if (attempt >= writeRetries) {
          throw new CorpusStoreException(
              namespaceId, "Failed to write snapshot after " + attempt + " attempts", e);
        }
        log.warn(
            "Snapshot write attempt {} for {} failed: {}", attempt, namespaceId, e.getMessage());
        backOff(attempt, namespaceId, e);
      }
    }
  }

  /** Resolves the file backing a namespace; see {@link NamespaceFileNames} for the naming. */
  Path fileFor(String namespaceId) {
    return basePath.resolve(NamespaceFileNames.stem(namespaceId) + ".json");
  }

  private static int retainNamespace(CorpusSnapshot snapshot, String namespaceId) {
    int before = snapshot.documents().size() + snapshot.chunks().size();
    snapshot.documents().removeIf(doc -> !namespaceId.equals(doc.getNamespaceId()));
    snapshot.chunks().removeIf(chunk -> !namespaceId.equals(chunk.getNamespaceId()));
    return before - snapshot.documents().size() - snapshot.chunks().size();
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(
          temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.debug("Could not remove temp file {}: {}", temp, e.getMessage());
    }
  }

  private static void backOff(int attempt, String namespaceId, IOException cause) {
    try {
      Thread.sleep(RETRY_DELAY_MS * attempt);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CorpusStoreException(
          namespaceId, "Interrupted while retrying snapshot write", cause);
    }
  }
}
