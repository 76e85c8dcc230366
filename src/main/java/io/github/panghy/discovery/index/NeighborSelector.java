package io.github.panghy.discovery.index;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks a diverse neighbour list for a node out of candidates sorted nearest first.
 *
 * <p>A candidate is dominated when it lies closer to an already selected neighbour than
 * {@code alpha} times its distance to the base node; dominated candidates are skipped so links
 * spread out in different directions. With {@code alpha = 1} this is the HNSW selection
 * heuristic. When fewer than {@code maxDegree} candidates survive, the list is back-filled with the
 * nearest dominated ones so sparse regions keep their full degree.</p>
 */
public final class NeighborSelector {
  private NeighborSelector() {}

  public static final double DEFAULT_ALPHA = 1.0;

  /** Distance between two nodes, by internal slot. */
  @FunctionalInterface
  public interface PairwiseDistance {
    float between(int slotA, int slotB);
  }

  public static List<SearchCandidate> select(
      List<SearchCandidate> sortedCandidates, int maxDegree, PairwiseDistance pairwise) {
    return select(sortedCandidates, maxDegree, DEFAULT_ALPHA, pairwise);
  }

  /**
   * @param sortedCandidates candidates ordered by {@link SearchCandidate#NEAREST_FIRST}
   * @param maxDegree        upper bound on the returned list
   * @param alpha            diversity factor; lower prunes harder
   * @param pairwise         distance between candidates
   * @return at most {@code maxDegree} candidates, selected ones first then back-fill, each in
   *     nearest-first order
   */
  public static List<SearchCandidate> select(
      List<SearchCandidate> sortedCandidates, int maxDegree, double alpha, PairwiseDistance pairwise) {
    if (sortedCandidates.size() <= maxDegree) return new ArrayList<>(sortedCandidates);
    List<SearchCandidate> selected = new ArrayList<>(maxDegree);
    List<SearchCandidate> dominated = new ArrayList<>();
    for (SearchCandidate candidate : sortedCandidates) {
      if (selected.size() >= maxDegree) break;
      boolean keep = true;
      for (SearchCandidate s : selected) {
        if (pairwise.between(candidate.getSlot(), s.getSlot()) < alpha * candidate.getDistance()) {
          keep = false;
          break;
        }
      }
      if (keep) {
        selected.add(candidate);
      } else {
        dominated.add(candidate);
      }
    }
    for (SearchCandidate d : dominated) {
      if (selected.size() >= maxDegree) break;
      selected.add(d);
    }
    return selected;
  }
}
