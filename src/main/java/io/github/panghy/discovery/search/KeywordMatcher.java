package io.github.panghy.discovery.search;

import io.github.panghy.discovery.api.Item;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring matching of query tokens against item text.
 */
public final class KeywordMatcher {
  private KeywordMatcher() {}

  /**
   * @param item  matching item
   * @param score number of distinct query tokens found in the item's text
   */
  public record Hit(Item item, int score) {}

  static final Comparator<Hit> ORDER = Comparator.comparingInt(Hit::score).reversed()
      .thenComparing((Hit h) -> h.item().recency(), Comparator.reverseOrder())
      .thenComparingLong(h -> h.item().id());

  /**
   * Scores every item by the number of {@code tokens} contained in its {@code textContent}.
   * Items scoring 0 are dropped; the rest are ordered by score, then recency (newest first), then
   * id.
   *
   * @param tokens lowercase, de-duplicated query tokens
   */
  public static List<Hit> match(List<String> tokens, Collection<Item> items) {
    if (tokens.isEmpty()) return List.of();
    List<Hit> hits = new ArrayList<>();
    for (Item item : items) {
      String text = item.textContent() == null ? "" : item.textContent().toLowerCase(Locale.ROOT);
      int score = 0;
      for (String token : tokens) {
        if (text.contains(token)) score++;
      }
      if (score > 0) hits.add(new Hit(item, score));
    }
    hits.sort(ORDER);
    return hits;
  }
}
