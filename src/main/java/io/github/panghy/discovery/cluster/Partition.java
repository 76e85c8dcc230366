package io.github.panghy.discovery.cluster;

import io.github.panghy.discovery.graph.KnnGraph;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Assignment of graph nodes to communities. Communities are numbered {@code 0..n-1} in order of
 * their smallest member id.
 */
public final class Partition {
  private final Map<Long, Integer> communityOf;
  private final List<SortedSet<Long>> communities;

  /**
   * @param ids        node ids
   * @param membership arbitrary community label per node, parallel to {@code ids}
   */
  Partition(List<Long> ids, int[] membership) {
    Map<Integer, SortedSet<Long>> byLabel = new HashMap<>();
    for (int i = 0; i < ids.size(); i++) {
      byLabel.computeIfAbsent(membership[i], k -> new TreeSet<>()).add(ids.get(i));
    }
    List<SortedSet<Long>> groups = new ArrayList<>(byLabel.values());
    groups.sort((a, b) -> Long.compare(a.first(), b.first()));
    this.communities = new ArrayList<>(groups.size());
    this.communityOf = new HashMap<>();
    for (int c = 0; c < groups.size(); c++) {
      SortedSet<Long> members = Collections.unmodifiableSortedSet(groups.get(c));
      communities.add(members);
      for (long id : members) communityOf.put(id, c);
    }
  }

  /** Builds a partition from explicit groups (each id in exactly one group). */
  public static Partition of(List<? extends Iterable<Long>> groups) {
    List<Long> ids = new ArrayList<>();
    List<Integer> labels = new ArrayList<>();
    for (int g = 0; g < groups.size(); g++) {
      for (long id : groups.get(g)) {
        ids.add(id);
        labels.add(g);
      }
    }
    int[] membership = new int[labels.size()];
    for (int i = 0; i < membership.length; i++) membership[i] = labels.get(i);
    return new Partition(ids, membership);
  }

  /** Community index of {@code id}, or -1 when the id is not partitioned. */
  public int communityOf(long id) {
    return communityOf.getOrDefault(id, -1);
  }

  public int communityCount() {
    return communities.size();
  }

  /** Members of every community, by index. */
  public List<SortedSet<Long>> communities() {
    return Collections.unmodifiableList(communities);
  }

  /** Number of partitioned nodes. */
  public int size() {
    return communityOf.size();
  }

  /**
   * Modularity of {@code partition} on {@code graph}:
   * {@code Q = Σ_c [ in_c / m - γ (tot_c / 2m)^2 ]}. Nodes missing from the partition count as
   * singletons. 0 for a graph without edges.
   */
  public static double modularity(KnnGraph graph, Partition partition, double resolution) {
    double m = graph.totalWeight();
    if (m <= 0) return 0.0;
    Map<Long, Double> internal = new HashMap<>();
    Map<Long, Double> total = new HashMap<>();
    for (long id : graph.nodes()) {
      long key = key(partition, id);
      total.merge(key, graph.degree(id), Double::sum);
      for (var e : graph.neighbors(id).entrySet()) {
        if (key(partition, e.getKey()) == key) internal.merge(key, e.getValue() / 2, Double::sum);
      }
    }
    double q = 0;
    for (var e : total.entrySet()) {
      double tot = e.getValue();
      q += internal.getOrDefault(e.getKey(), 0.0) / m - resolution * (tot / (2 * m)) * (tot / (2 * m));
    }
    return q;
  }

  // communities map to non-negative keys, unpartitioned nodes to a key of their own
  private static long key(Partition partition, long id) {
    int c = partition.communityOf(id);
    return c >= 0 ? c : -1 - id;
  }

  @Override
  public String toString() {
    return "Partition(nodes=" + size() + ", communities=" + communityCount() + ")";
  }
}
