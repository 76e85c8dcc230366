package io.github.panghy.discovery.index;

import java.util.Comparator;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A node under consideration during layer search or neighbour selection.
 */
@Data
@AllArgsConstructor
public class SearchCandidate implements Comparable<SearchCandidate> {
  /** Closest first; equal distances fall back to the smaller item id. */
  public static final Comparator<SearchCandidate> NEAREST_FIRST = Comparator.naturalOrder();

  /** Farthest first, for bounded result heaps. */
  public static final Comparator<SearchCandidate> FARTHEST_FIRST = NEAREST_FIRST.reversed();

  /** Internal slot of the node. */
  private final int slot;

  /** External item id. */
  private final long itemId;

  /** Distance from the query (lower is closer). */
  private final float distance;

  @Override
  public int compareTo(SearchCandidate other) {
    int c = Float.compare(this.distance, other.distance);
    return c != 0 ? c : Long.compare(this.itemId, other.itemId);
  }

  @Override
  public String toString() {
    return String.format("SearchCandidate(itemId=%d, distance=%.4f)", itemId, distance);
  }
}
