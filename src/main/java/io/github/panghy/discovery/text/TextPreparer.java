package io.github.panghy.discovery.text;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes text before it reaches the encoder: lowercased, HTML and URLs stripped, whitespace
 * collapsed, truncated at a word boundary to the model's character budget.
 */
public final class TextPreparer {
  private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
  private static final Pattern HTML_ENTITY = Pattern.compile("&(#\\d+|#x[0-9a-fA-F]+|[a-zA-Z]+);");
  private static final Pattern URL = Pattern.compile("(?i)(https?://\\S+|www\\.\\S+)");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final int maxLength;

  public TextPreparer(int maxLength) {
    if (maxLength <= 0) throw new IllegalArgumentException("maxLength must be positive");
    this.maxLength = maxLength;
  }

  public int getMaxLength() {
    return maxLength;
  }

  /**
   * Prepares {@code text}; returns an empty string when nothing meaningful remains.
   */
  public String prepare(String text) {
    if (text == null) return "";
    String s = text.toLowerCase(Locale.ROOT);
    s = HTML_TAG.matcher(s).replaceAll(" ");
    s = HTML_ENTITY.matcher(s).replaceAll(m -> decodeEntity(m.group(1)));
    s = URL.matcher(s).replaceAll(" ");
    s = WHITESPACE.matcher(s).replaceAll(" ").trim();
    return truncateAtWordBoundary(s, maxLength);
  }

  /**
   * Cuts {@code text} to at most {@code maxLength} characters, backing up to the last space when
   * one exists so words are not split.
   */
  public static String truncateAtWordBoundary(String text, int maxLength) {
    if (text.length() <= maxLength) return text;
    String cut = text.substring(0, maxLength);
    int lastSpace = cut.lastIndexOf(' ');
    return (lastSpace > 0 ? cut.substring(0, lastSpace) : cut).trim();
  }

  private static String decodeEntity(String name) {
    switch (name) {
      case "amp":
        return "&";
      case "lt":
        return "<";
      case "gt":
        return ">";
      case "quot":
        return "\"";
      case "apos":
      case "#39":
        return "'";
      default:
        return " ";
    }
  }
}
