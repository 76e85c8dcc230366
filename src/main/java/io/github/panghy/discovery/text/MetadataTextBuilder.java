package io.github.panghy.discovery.text;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds the text an item is embedded from.
 *
 * <p>Components in priority order: title (kept in full), {@code "by <channel>"}, tags, description,
 * OCR text. Lower-priority components only get the space the higher ones leave within
 * {@link #TARGET_TEXT_LENGTH}. Components are joined with newlines.</p>
 */
public final class MetadataTextBuilder {
  private MetadataTextBuilder() {}

  public static final int TARGET_TEXT_LENGTH = 1000;
  public static final int MAX_TAGS = 10;
  public static final int MAX_CONSECUTIVE_EMOJI = 3;
  public static final int MAX_TOTAL_EMOJI = 10;

  static final int COMPONENT_SEPARATOR_BUFFER = 10;
  static final int OCR_SEPARATOR_BUFFER = 5;
  static final int MIN_DESCRIPTION_SPACE = 50;
  static final int MIN_OCR_SPACE = 20;

  /** Tags too generic to say anything about the content. */
  public static final Set<String> GENERIC_TAGS = Set.of(
      "shorts", "short", "viral", "trending", "fyp", "foryou", "foryoupage", "subscribe",
      "like", "likes", "follow", "video", "videos", "youtube", "youtuber", "vlog", "new", "best",
      "funny", "explore", "explorepage", "tiktok", "reels");

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern HTTP_URL = Pattern.compile("https?://\\S+");
  private static final Pattern WWW_URL = Pattern.compile("www\\.\\S+");
  private static final Pattern REPEATED_PUNCTUATION = Pattern.compile("([!?.]){3,}");
  private static final Pattern SPAM_PHRASE = Pattern.compile(
      "(?i)(follow|subscribe|like|share|comment)\\s+(me|us|for|to|and|if|the|my|our)[^.!?]*[.!?]?");

  private static final int VARIATION_SELECTOR = 0xFE0F;
  private static final int ZERO_WIDTH_JOINER = 0x200D;

  /**
   * Combines metadata into embedding text; never longer than {@link #TARGET_TEXT_LENGTH}.
   * Every argument except {@code title} may be {@code null}.
   */
  public static String buildText(
      String title, String channel, List<String> tags, String description, String ocrText) {
    List<String> components = new ArrayList<>();

    String cleanedTitle = cleanText(title == null ? "" : title);
    if (!cleanedTitle.isEmpty()) components.add(cleanedTitle);

    if (channel != null) {
      String cleanedChannel = cleanText(channel);
      if (!cleanedChannel.isEmpty()) components.add("by " + cleanedChannel);
    }

    if (tags != null) {
      List<String> processed = processTags(tags);
      if (!processed.isEmpty()) components.add(String.join(" ", processed));
    }

    int remaining = Math.max(
        0, TARGET_TEXT_LENGTH - String.join("\n", components).length() - COMPONENT_SEPARATOR_BUFFER);
    if (description != null && remaining > MIN_DESCRIPTION_SPACE) {
      String desc = TextPreparer.truncateAtWordBoundary(cleanDescription(description), remaining);
      if (!desc.isEmpty()) components.add(desc);
    }

    int spaceForOcr = Math.max(
        0, TARGET_TEXT_LENGTH - String.join("\n", components).length() - OCR_SEPARATOR_BUFFER);
    if (ocrText != null && spaceForOcr > MIN_OCR_SPACE) {
      String ocr = TextPreparer.truncateAtWordBoundary(cleanText(ocrText), spaceForOcr);
      if (!ocr.isEmpty()) components.add(ocr);
    }

    String result = String.join("\n", components);
    return result.length() > TARGET_TEXT_LENGTH ? result.substring(0, TARGET_TEXT_LENGTH) : result;
  }

  /**
   * Collapses whitespace, limits emoji runs and trims.
   */
  public static String cleanText(String text) {
    String cleaned = WHITESPACE.matcher(text).replaceAll(" ");
    return limitEmoji(cleaned).trim();
  }

  /**
   * Removes URLs, punctuation runs and follow/subscribe spam, then applies {@link #cleanText}.
   */
  public static String cleanDescription(String text) {
    String cleaned = HTTP_URL.matcher(text).replaceAll("");
    cleaned = WWW_URL.matcher(cleaned).replaceAll("");
    cleaned = REPEATED_PUNCTUATION.matcher(cleaned).replaceAll("$1");
    cleaned = SPAM_PHRASE.matcher(cleaned).replaceAll("");
    return cleanText(cleaned);
  }

  /**
   * Lowercases, trims and de-duplicates tags, dropping single-character and generic ones; keeps at
   * most {@link #MAX_TAGS}.
   */
  public static List<String> processTags(List<String> tags) {
    Set<String> seen = new HashSet<>();
    List<String> out = new ArrayList<>();
    for (String tag : tags) {
      if (tag == null) continue;
      String cleaned = tag.toLowerCase(Locale.ROOT).trim();
      if (cleaned.length() <= 1 || GENERIC_TAGS.contains(cleaned) || !seen.add(cleaned)) continue;
      out.add(cleaned);
      if (out.size() >= MAX_TAGS) break;
    }
    return out;
  }

  static boolean isEmoji(int codePoint) {
    return (codePoint >= 0x1F300 && codePoint <= 0x1FAFF) || (codePoint >= 0x2600 && codePoint <= 0x27BF);
  }

  private static String limitEmoji(String text) {
    StringBuilder out = new StringBuilder(text.length());
    int total = 0;
    int consecutive = 0;
    boolean lastKept = false;
    for (int i = 0; i < text.length(); ) {
      int cp = text.codePointAt(i);
      i += Character.charCount(cp);
      if (isEmoji(cp)) {
        consecutive++;
        lastKept = consecutive <= MAX_CONSECUTIVE_EMOJI && total < MAX_TOTAL_EMOJI;
        if (lastKept) {
          out.appendCodePoint(cp);
          total++;
        }
      } else if (cp == VARIATION_SELECTOR || cp == ZERO_WIDTH_JOINER) {
        // modifiers follow the emoji they decorate
        if (lastKept) out.appendCodePoint(cp);
      } else {
        consecutive = 0;
        lastKept = false;
        out.appendCodePoint(cp);
      }
    }
    return out.toString();
  }
}
