package com.flamingo.ai.researchtwin.service.rag.similarity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Normalized keys derived from text: content hashes, paper keys and alias match forms. */
public final class TextKeys {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
  private static final Pattern FILE_EXTENSION =
      Pattern.compile("\\.[a-z0-9]{2,6}$", Pattern.CASE_INSENSITIVE);
  private static final Pattern SEPARATORS = Pattern.compile("[_-]+");

  private TextKeys() {}

  /** SHA-1 hex digest of the lower-cased, whitespace-collapsed text. */
  public static String textHash(String text) {
    return sha1Hex(WHITESPACE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim());
  }

  /** SHA-1 hex digest of the UTF-8 bytes of {@code value}, without normalization. */
  public static String sha1Hex(String value) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-1");
      StringBuilder hex = new StringBuilder();
      for (byte b : digest.digest(value.getBytes(StandardCharsets.UTF_8))) {
        hex.append(String.format("%02x", b));
      }
      return hex.toString();
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-1 not available", e);
    }
  }

  /** Lower-cases and collapses every run of non-alphanumerics into a single space. */
  public static String matchText(String value) {
    if (value == null) {
      return "";
    }
    return NON_ALPHANUMERIC.matcher(value.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
  }

  /** Tokens of {@link #matchText(String)} longer than one character. */
  public static List<String> matchTokens(String value) {
    String normalized = matchText(value);
    if (normalized.isEmpty()) {
      return List.of();
    }
    return Arrays.stream(normalized.split(" ")).filter(token -> token.length() > 1).toList();
  }

  public static String stripExtension(String fileName) {
    return FILE_EXTENSION.matcher(fileName).replaceFirst("");
  }

  /** File name without extension and with underscores/dashes turned into spaces. */
  public static String fileStem(String fileName) {
    return SEPARATORS.matcher(stripExtension(fileName)).replaceAll(" ");
  }

  /**
   * Key grouping chunks of one logical paper: the title when known, else the file name without
   * extension, in match form. Returns {@code null} when nothing alphanumeric remains.
   */
  public static String paperKey(String fileName, String title) {
    String base = title != null && !title.isBlank() ? title : fileName;
    if (base == null) {
      return null;
    }
    String key = matchText(stripExtension(base.toLowerCase(Locale.ROOT)));
    return key.isEmpty() ? null : key;
  }
}
