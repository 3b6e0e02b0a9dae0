package com.flamingo.ai.researchtwin.service.rag.evidence;

import java.util.List;

/**
 * Catalog entry for a published paper.
 *
 * @param title full paper title
 * @param venue publication venue, e.g. {@code WACV}
 * @param year publication year
 * @param aliases short names and file names the paper is known by
 */
public record CanonicalPublication(String title, String venue, String year, List<String> aliases) {

  public CanonicalPublication {
    aliases = aliases == null ? List.of() : List.copyOf(aliases);
  }

  /** Formatted as {@code "<title> (<venue> <year>)"}. */
  public String citation() {
    return title + " (" + venue + " " + year + ")";
  }
}
