package com.flamingo.ai.researchtwin.store;

import com.flamingo.ai.researchtwin.service.rag.similarity.TextKeys;
import java.util.regex.Pattern;

/**
 * Maps namespace ids to store file stems without collisions.
 *
 * <p>Ids made only of {@code [a-zA-Z0-9_-]} are used as they are. Any other id has its unsafe
 * characters replaced by underscores and gets a {@code .<sha1 prefix>} suffix of the raw id.
 * Safe stems never contain a dot, so a rewritten id can never equal a safe one.
 */
final class NamespaceFileNames {

  private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-zA-Z0-9_-]");
  private static final int HASH_LENGTH = 12;

  private NamespaceFileNames() {}

  static String stem(String namespaceId) {
    String sanitized = UNSAFE_CHARS.matcher(namespaceId).replaceAll("_");
    if (sanitized.equals(namespaceId) && !sanitized.isEmpty()) {
      return sanitized;
    }
    return sanitized + "." + TextKeys.sha1Hex(namespaceId).substring(0, HASH_LENGTH);
  }
}
