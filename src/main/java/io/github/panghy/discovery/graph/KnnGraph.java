package io.github.panghy.discovery.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Undirected weighted similarity graph keyed by item id.
 *
 * <p>Adjacency is kept in sorted maps so iteration order, and everything computed from it, is
 * deterministic. Not thread-safe.</p>
 */
public final class KnnGraph {
  private final NavigableMap<Long, NavigableMap<Long, Double>> adjacency = new TreeMap<>();
  private double totalWeight;
  private int edgeCount;

  /** Adds an isolated node; no-op when present. */
  public void addNode(long id) {
    adjacency.computeIfAbsent(id, k -> new TreeMap<>());
  }

  /**
   * Adds the undirected edge {@code a - b}. Both nodes are created if missing. A repeated edge
   * keeps the larger weight; self edges and non-positive weights are ignored.
   *
   * @return whether the graph changed
   */
  public boolean addEdge(long a, long b, double weight) {
    if (a == b || !(weight > 0)) return false;
    addNode(a);
    addNode(b);
    Double existing = adjacency.get(a).get(b);
    if (existing != null && existing >= weight) return false;
    adjacency.get(a).put(b, weight);
    adjacency.get(b).put(a, weight);
    if (existing == null) {
      edgeCount++;
      totalWeight += weight;
    } else {
      totalWeight += weight - existing;
    }
    return true;
  }

  /** Removes a node and its edges; returns whether it was present. */
  public boolean removeNode(long id) {
    NavigableMap<Long, Double> edges = adjacency.remove(id);
    if (edges == null) return false;
    for (var e : edges.entrySet()) {
      adjacency.get(e.getKey()).remove(id);
      edgeCount--;
      totalWeight -= e.getValue();
    }
    return true;
  }

  public boolean containsNode(long id) {
    return adjacency.containsKey(id);
  }

  /** Neighbours of {@code id} with edge weights, ascending by id; empty for unknown nodes. */
  public NavigableMap<Long, Double> neighbors(long id) {
    NavigableMap<Long, Double> edges = adjacency.get(id);
    return edges == null ? Collections.emptyNavigableMap() : Collections.unmodifiableNavigableMap(edges);
  }

  /** Weight of {@code a - b}, 0 when not connected. */
  public double weight(long a, long b) {
    NavigableMap<Long, Double> edges = adjacency.get(a);
    if (edges == null) return 0.0;
    return edges.getOrDefault(b, 0.0);
  }

  /** Weighted degree (sum of incident edge weights). */
  public double degree(long id) {
    double sum = 0;
    for (double w : neighbors(id).values()) sum += w;
    return sum;
  }

  /** Sum of edge weights, each undirected edge counted once. */
  public double totalWeight() {
    return totalWeight;
  }

  public int nodeCount() {
    return adjacency.size();
  }

  public int edgeCount() {
    return edgeCount;
  }

  /** Node ids, ascending. */
  public List<Long> nodes() {
    return new ArrayList<>(adjacency.keySet());
  }

  public KnnGraph copy() {
    KnnGraph g = new KnnGraph();
    for (var e : adjacency.entrySet()) g.adjacency.put(e.getKey(), new TreeMap<>(e.getValue()));
    g.totalWeight = totalWeight;
    g.edgeCount = edgeCount;
    return g;
  }

  @Override
  public String toString() {
    return String.format("KnnGraph(nodes=%d, edges=%d, totalWeight=%.4f)", nodeCount(), edgeCount, totalWeight);
  }
}
