package io.github.panghy.discovery.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits text into lowercase terms.
 */
public final class Tokenizer {
  private Tokenizer() {}

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}']+");
  private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

  /**
   * Query tokens for keyword matching: whitespace split, lowercased, surrounding punctuation
   * trimmed, stopwords removed, first occurrence order kept, duplicates dropped.
   */
  public static List<String> queryTokens(String query) {
    if (query == null || query.isBlank()) return List.of();
    Set<String> out = new LinkedHashSet<>();
    for (String raw : WHITESPACE.split(query.trim().toLowerCase(Locale.ROOT))) {
      String token = EDGE_PUNCTUATION.matcher(raw).replaceAll("");
      if (token.isEmpty() || Stopwords.isStopword(token)) continue;
      out.add(token);
    }
    return List.copyOf(out);
  }

  /**
   * Content terms for label extraction: letters/digits runs, lowercased, stopwords, purely
   * numeric terms and terms shorter than {@code minLength} removed. Duplicates are kept.
   */
  public static List<String> terms(String text, int minLength) {
    if (text == null || text.isEmpty()) return List.of();
    List<String> out = new ArrayList<>();
    for (String raw : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
      String term = EDGE_PUNCTUATION.matcher(raw).replaceAll("");
      if (term.length() < minLength || Stopwords.isStopword(term) || isNumeric(term)) continue;
      out.add(term);
    }
    return out;
  }

  private static boolean isNumeric(String term) {
    for (int i = 0; i < term.length(); i++) {
      if (!Character.isDigit(term.charAt(i))) return false;
    }
    return true;
  }
}
