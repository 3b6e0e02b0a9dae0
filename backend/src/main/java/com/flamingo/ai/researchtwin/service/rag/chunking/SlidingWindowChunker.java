package com.flamingo.ai.researchtwin.service.rag.chunking;

import com.flamingo.ai.researchtwin.config.RagConfig;
import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits normalized document text into overlapping fixed-size character windows.
 *
 * <p>Window size and overlap depend on the document's {@link SourceRole}: thesis chapters get
 * larger windows than publications so narrative passages stay intact. The chunker is stateless and
 * safe for concurrent use.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlidingWindowChunker {

  private final RagConfig ragConfig;

  /**
   * Chunks text with the window configured for the given role.
   *
   * @param text the extracted document text
   * @param role the document's source role
   * @return ordered, non-empty chunk texts; empty when the text is blank
   */
  public List<String> chunk(String text, SourceRole role) {
    RagConfig.Window window = ragConfig.getChunking().forRole(role);
    List<String> chunks = chunk(text, window.getSize(), window.getOverlap());
    log.debug(
        "Chunked {} chars into {} windows (role={}, size={}, overlap={})",
        text == null ? 0 : text.length(),
        chunks.size(),
        role,
        window.getSize(),
        window.getOverlap());
    return chunks;
  }

  /**
   * Slides a window of {@code size} characters over the text, stepping by {@code size - overlap}.
   * The last window always ends at the end of the text. Each slice is trimmed and blank slices
   * are dropped.
   */
  public static List<String> chunk(String text, int size, int overlap) {
    if (text == null) {
      return List.of();
    }
    String normalized = text.replace("\r\n", "\n").trim();
    if (normalized.isEmpty() || size <= 0) {
      return List.of();
    }

    List<String> chunks = new ArrayList<>();
    int length = normalized.length();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + size, length);
      String slice = normalized.substring(start, end).trim();
      if (!slice.isEmpty()) {
        chunks.add(slice);
      }
      if (end >= length) {
        break;
      }
      int next = Math.max(0, end - overlap);
      // overlap >= size would never advance
      start = next > start ? next : end;
    }
    return chunks;
  }
}
