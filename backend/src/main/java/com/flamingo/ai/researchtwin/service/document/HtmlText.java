package com.flamingo.ai.researchtwin.service.document;

import java.net.URI;
import java.util.regex.Pattern;

/** Plain-text extraction and file naming for crawled web pages. */
final class HtmlText {

  private static final Pattern SCRIPT =
      Pattern.compile("<script[\\s\\S]*?</script>", Pattern.CASE_INSENSITIVE);
  private static final Pattern STYLE =
      Pattern.compile("<style[\\s\\S]*?</style>", Pattern.CASE_INSENSITIVE);
  private static final Pattern NOSCRIPT =
      Pattern.compile("<noscript[\\s\\S]*?</noscript>", Pattern.CASE_INSENSITIVE);
  private static final Pattern TAG = Pattern.compile("<[^>]+>");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern UNSAFE_STEM_CHARS = Pattern.compile("[^a-zA-Z0-9/_-]");
  private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");
  private static final int QUERY_SUFFIX_LENGTH = 7;

  private HtmlText() {}

  /** Drops scripts, styles and tags, decodes the basic entities and collapses whitespace. */
  static String toText(String html) {
    if (html == null) {
      return "";
    }
    String text = SCRIPT.matcher(html).replaceAll(" ");
    text = STYLE.matcher(text).replaceAll(" ");
    text = NOSCRIPT.matcher(text).replaceAll(" ");
    text = TAG.matcher(text).replaceAll(" ");
    text =
        text.replaceAll("(?i)&nbsp;", " ")
            .replaceAll("(?i)&amp;", "&")
            .replaceAll("(?i)&lt;", "<")
            .replaceAll("(?i)&gt;", ">");
    return WHITESPACE.matcher(text).replaceAll(" ").trim();
  }

  /**
   * File name for a crawled page: host plus path with unsafe characters as underscores and a
   * {@code .txt} extension. A query string adds a short hash suffix so distinct queries do not
   * replace each other.
   */
  static String fileNameFor(URI url) {
    String host = url.getHost() == null ? "" : url.getHost();
    String path = url.getPath() == null || "/".equals(url.getPath()) ? "" : url.getPath();
    String stem = UNSAFE_STEM_CHARS.matcher(host + path).replaceAll("_").replace('/', '_');
    stem = EDGE_UNDERSCORES.matcher(stem).replaceAll("");
    if (stem.isEmpty()) {
      stem = "crawled_page";
    }
    String query = url.getRawQuery();
    if (query == null || query.isEmpty()) {
      return stem + ".txt";
    }
    return stem + "_" + querySuffix(("?" + query).hashCode()) + ".txt";
  }

  /** Unsigned base-36 rendering of a query hash, cut to seven characters. */
  static String querySuffix(int hash) {
    String suffix = Integer.toUnsignedString(hash, 36);
    return suffix.substring(0, Math.min(QUERY_SUFFIX_LENGTH, suffix.length()));
  }
}
