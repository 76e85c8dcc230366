package io.github.panghy.discovery.cluster;

import io.github.panghy.discovery.graph.KnnGraph;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Compact (CSR) weighted graph over dense node indices, used inside the Leiden passes.
 *
 * <p>Each node may carry a self loop holding the internal weight of the community it stands for
 * after aggregation. {@code strength(i)} counts the self loop twice so that the strengths sum to
 * {@code 2m}, twice the total edge weight.</p>
 */
final class WeightedGraph {
  private final int nodeCount;
  private final int[] offsets;
  private final int[] targets;
  private final double[] weights;
  private final double[] selfLoops;
  private final double[] strengths;
  private final double totalStrength;

  private WeightedGraph(int nodeCount, int[] offsets, int[] targets, double[] weights, double[] selfLoops) {
    this.nodeCount = nodeCount;
    this.offsets = offsets;
    this.targets = targets;
    this.weights = weights;
    this.selfLoops = selfLoops;
    this.strengths = new double[nodeCount];
    double total = 0;
    for (int i = 0; i < nodeCount; i++) {
      double s = 2 * selfLoops[i];
      for (int e = offsets[i]; e < offsets[i + 1]; e++) s += weights[e];
      strengths[i] = s;
      total += s;
    }
    this.totalStrength = total;
  }

  /**
   * Converts a similarity graph; node {@code i} is {@code ids.get(i)}.
   */
  static WeightedGraph from(KnnGraph graph, List<Long> ids) {
    Map<Long, Integer> index = new TreeMap<>();
    for (int i = 0; i < ids.size(); i++) index.put(ids.get(i), i);
    int n = ids.size();
    int[] offsets = new int[n + 1];
    for (int i = 0; i < n; i++) offsets[i + 1] = offsets[i] + graph.neighbors(ids.get(i)).size();
    int[] targets = new int[offsets[n]];
    double[] weights = new double[offsets[n]];
    for (int i = 0; i < n; i++) {
      int e = offsets[i];
      for (var edge : graph.neighbors(ids.get(i)).entrySet()) {
        targets[e] = index.get(edge.getKey());
        weights[e] = edge.getValue();
        e++;
      }
    }
    return new WeightedGraph(n, offsets, targets, weights, new double[n]);
  }

  /**
   * Collapses each community of {@code membership} into one node. Edges between communities are
   * summed; edges inside a community become its self loop.
   *
   * @param membership  community of every node, values in {@code [0, communities)}
   * @param communities number of communities
   */
  WeightedGraph aggregate(int[] membership, int communities) {
    double[] loops = new double[communities];
    List<TreeMap<Integer, Double>> rows = new ArrayList<>(communities);
    for (int c = 0; c < communities; c++) rows.add(new TreeMap<>());
    for (int i = 0; i < nodeCount; i++) {
      int ci = membership[i];
      loops[ci] += selfLoops[i];
      for (int e = offsets[i]; e < offsets[i + 1]; e++) {
        int cj = membership[targets[e]];
        if (ci == cj) {
          // each internal edge is seen from both ends
          loops[ci] += weights[e] / 2;
        } else {
          rows.get(ci).merge(cj, weights[e], Double::sum);
        }
      }
    }
    int[] offs = new int[communities + 1];
    for (int c = 0; c < communities; c++) offs[c + 1] = offs[c] + rows.get(c).size();
    int[] tg = new int[offs[communities]];
    double[] wt = new double[offs[communities]];
    for (int c = 0; c < communities; c++) {
      int e = offs[c];
      for (var entry : rows.get(c).entrySet()) {
        tg[e] = entry.getKey();
        wt[e] = entry.getValue();
        e++;
      }
    }
    return new WeightedGraph(communities, offs, tg, wt, loops);
  }

  int nodeCount() {
    return nodeCount;
  }

  int edgeStart(int node) {
    return offsets[node];
  }

  int edgeEnd(int node) {
    return offsets[node + 1];
  }

  int target(int edge) {
    return targets[edge];
  }

  double weight(int edge) {
    return weights[edge];
  }

  double selfLoop(int node) {
    return selfLoops[node];
  }

  double strength(int node) {
    return strengths[node];
  }

  /** {@code 2m}: the sum of all strengths. */
  double totalStrength() {
    return totalStrength;
  }

  /** Modularity of {@code membership} at resolution {@code gamma}; 0 for a graph without edges. */
  double modularity(int[] membership, int communities, double gamma) {
    if (totalStrength <= 0) return 0.0;
    double[] internal = new double[communities];
    double[] total = new double[communities];
    for (int i = 0; i < nodeCount; i++) {
      int c = membership[i];
      total[c] += strengths[i];
      internal[c] += 2 * selfLoops[i];
      for (int e = offsets[i]; e < offsets[i + 1]; e++) {
        if (membership[targets[e]] == c) internal[c] += weights[e];
      }
    }
    double q = 0;
    for (int c = 0; c < communities; c++) {
      q += internal[c] / totalStrength - gamma * (total[c] / totalStrength) * (total[c] / totalStrength);
    }
    return q;
  }
}
