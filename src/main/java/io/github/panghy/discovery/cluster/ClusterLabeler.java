package io.github.panghy.discovery.cluster;

import io.github.panghy.discovery.api.Item;
import io.github.panghy.discovery.text.Tokenizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Generates short human-readable cluster labels from member text.
 */
public class ClusterLabeler {
  public static final String FALLBACK_LABEL = "Misc";
  public static final int MIN_TERMS = 3;
  public static final int MAX_TERMS = 5;
  static final int MIN_TERM_LENGTH = 3;

  private final int termCount;

  /**
   * @param termCount number of terms per label, clamped to {@code [3, 5]}
   */
  public ClusterLabeler(int termCount) {
    this.termCount = Math.max(MIN_TERMS, Math.min(MAX_TERMS, termCount));
  }

  public int getTermCount() {
    return termCount;
  }

  /**
   * Top terms across the members' text: ranked by the number of members that use the term, then
   * by total occurrences, then alphabetically. Title-cased and comma-joined; {@value
   * #FALLBACK_LABEL} when no usable term exists.
   */
  public String label(Collection<Item> members) {
    Map<String, Integer> documentFrequency = new HashMap<>();
    Map<String, Integer> totalFrequency = new HashMap<>();
    for (Item item : members) {
      List<String> terms = Tokenizer.terms(item.textContent(), MIN_TERM_LENGTH);
      for (String term : terms) totalFrequency.merge(term, 1, Integer::sum);
      for (String term : new HashSet<>(terms)) documentFrequency.merge(term, 1, Integer::sum);
    }
    if (documentFrequency.isEmpty()) return FALLBACK_LABEL;
    List<String> ranked = new ArrayList<>(documentFrequency.keySet());
    ranked.sort((a, b) -> {
      int c = Integer.compare(documentFrequency.get(b), documentFrequency.get(a));
      if (c != 0) return c;
      c = Integer.compare(totalFrequency.get(b), totalFrequency.get(a));
      return c != 0 ? c : a.compareTo(b);
    });
    List<String> picked = new ArrayList<>(termCount);
    for (int i = 0; i < Math.min(termCount, ranked.size()); i++) picked.add(titleCase(ranked.get(i)));
    return String.join(", ", picked);
  }

  /**
   * Makes generated labels unique. Every label shared by several clusters, or equal to a reserved
   * (user-chosen) label, gets a {@code " #<hex>"} suffix derived from the cluster centroid.
   *
   * @param labels    generated label per cluster id
   * @param centroids centroid per cluster id
   * @param reserved  labels already taken by clusters that are not being relabelled
   * @return unique label per cluster id
   */
  public static Map<Long, String> disambiguate(
      Map<Long, String> labels, Map<Long, float[]> centroids, Set<String> reserved) {
    Map<String, List<Long>> byLabel = new TreeMap<>();
    for (var e : new TreeMap<>(labels).entrySet()) {
      byLabel.computeIfAbsent(e.getValue(), k -> new ArrayList<>()).add(e.getKey());
    }
    Set<String> used = new HashSet<>(reserved);
    for (var e : byLabel.entrySet()) {
      if (e.getValue().size() == 1 && !reserved.contains(e.getKey())) used.add(e.getKey());
    }
    Map<Long, String> out = new TreeMap<>();
    for (var e : byLabel.entrySet()) {
      String label = e.getKey();
      List<Long> ids = e.getValue();
      if (ids.size() == 1 && !reserved.contains(label)) {
        out.put(ids.get(0), label);
        continue;
      }
      for (long id : ids) {
        int hash = Arrays.hashCode(centroids.get(id));
        String candidate = label + " #" + String.format("%04x", hash & 0xffff);
        if (used.contains(candidate)) candidate = label + " #" + String.format("%08x", hash);
        if (used.contains(candidate)) candidate = label + " #" + String.format("%08x-%d", hash, id);
        used.add(candidate);
        out.put(id, candidate);
      }
    }
    return out;
  }

  static String titleCase(String term) {
    if (term.isEmpty()) return term;
    int first = term.codePointAt(0);
    return new String(Character.toChars(Character.toTitleCase(first)))
        + term.substring(Character.charCount(first)).toLowerCase(Locale.ROOT);
  }
}
