package io.github.panghy.discovery.search;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the keyword and vector rankings into one list.
 */
public final class RankFusion {

  /**
   * An entry of an input ranking.
   *
   * @param itemId item id
   * @param score  path-specific score: keyword match count or vector similarity
   */
  public record Hit(long itemId, double score) {}

  /**
   * A fused entry.
   *
   * @param keywordRank 1-based, {@code null} when the item is not in the keyword list
   * @param vectorRank  1-based, {@code null} when the item is not in the vector list
   */
  public record Fused(long itemId, double score, Integer keywordRank, Integer vectorRank) {}

  private final FusionStrategy strategy;
  private final int rrfK;
  private final double keywordWeight;
  private final double vectorWeight;

  public RankFusion(FusionStrategy strategy, int rrfK, double keywordWeight, double vectorWeight) {
    this.strategy = strategy;
    this.rrfK = rrfK;
    this.keywordWeight = keywordWeight;
    this.vectorWeight = vectorWeight;
  }

  /**
   * Fuses two rankings given best first. Output is sorted by fused score descending, ties by
   * ascending item id.
   */
  public List<Fused> fuse(List<Hit> keyword, List<Hit> vector) {
    Map<Long, Integer> keywordRanks = ranks(keyword);
    Map<Long, Integer> vectorRanks = ranks(vector);
    Map<Long, Double> scores = new LinkedHashMap<>();
    if (strategy == FusionStrategy.RECIPROCAL_RANK) {
      for (var e : keywordRanks.entrySet()) scores.merge(e.getKey(), 1.0 / (rrfK + e.getValue()), Double::sum);
      for (var e : vectorRanks.entrySet()) scores.merge(e.getKey(), 1.0 / (rrfK + e.getValue()), Double::sum);
    } else {
      double maxKeyword = 0;
      for (Hit h : keyword) maxKeyword = Math.max(maxKeyword, h.score());
      for (Hit h : keyword) {
        double normalized = maxKeyword > 0 ? h.score() / maxKeyword : 0.0;
        scores.merge(h.itemId(), keywordWeight * normalized, Double::sum);
      }
      for (Hit h : vector) scores.merge(h.itemId(), vectorWeight * Math.max(0.0, h.score()), Double::sum);
    }
    List<Fused> out = new ArrayList<>(scores.size());
    for (var e : scores.entrySet()) {
      out.add(new Fused(e.getKey(), e.getValue(), keywordRanks.get(e.getKey()), vectorRanks.get(e.getKey())));
    }
    out.sort((a, b) -> {
      int c = Double.compare(b.score(), a.score());
      return c != 0 ? c : Long.compare(a.itemId(), b.itemId());
    });
    return out;
  }

  // first occurrence wins when a list repeats an id
  private static Map<Long, Integer> ranks(List<Hit> hits) {
    Map<Long, Integer> out = new HashMap<>();
    int rank = 1;
    for (Hit h : hits) {
      if (!out.containsKey(h.itemId())) out.put(h.itemId(), rank);
      rank++;
    }
    return out;
  }
}
