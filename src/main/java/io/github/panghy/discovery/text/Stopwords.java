package io.github.panghy.discovery.text;

import java.util.Arrays;
import java.util.Set;

/**
 * English stopwords shared by keyword search and cluster labelling.
 */
public final class Stopwords {
  private Stopwords() {}

  private static final Set<String> WORDS = Set.copyOf(Arrays.asList(
      "a", "about", "above", "after", "again", "against", "all", "also", "am", "an", "and", "any",
      "are", "aren't", "as", "at", "be", "because", "been", "before", "being", "below", "between",
      "both", "but", "by", "can", "can't", "cannot", "could", "couldn't", "did", "didn't", "do",
      "does", "doesn't", "doing", "don't", "down", "during", "each", "even", "ever", "every", "few",
      "for", "from", "further", "get", "gets", "got", "had", "hadn't", "has", "hasn't", "have",
      "haven't", "having", "he", "her", "here", "hers", "herself", "him", "himself", "his", "how",
      "i", "if", "in", "into", "is", "isn't", "it", "it's", "its", "itself", "just", "let's", "like",
      "me", "more", "most", "much", "must", "my", "myself", "new", "no", "nor", "not", "now", "of",
      "off", "on", "once", "one", "only", "or", "other", "ought", "our", "ours", "ourselves", "out",
      "over", "own", "really", "same", "she", "should", "shouldn't", "so", "some", "still", "such",
      "than", "that", "that's", "the", "their", "theirs", "them", "themselves", "then", "there",
      "there's", "these", "they", "this", "those", "through", "to", "too", "under", "until", "up",
      "us", "very", "via", "was", "wasn't", "way", "we", "were", "weren't", "what", "when", "where",
      "which", "while", "who", "whom", "why", "will", "with", "won't", "would", "wouldn't", "you",
      "your", "yours", "yourself", "yourselves"));

  /** Whether {@code word} (already lowercased) is a stopword. */
  public static boolean isStopword(String word) {
    return WORDS.contains(word);
  }
}
