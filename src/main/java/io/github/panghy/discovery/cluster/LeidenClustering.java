package io.github.panghy.discovery.cluster;

import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.graph.KnnGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Leiden community detection maximizing modularity with a resolution parameter.
 *
 * <p>Each iteration runs three phases:
 * <ol>
 *   <li>local moving: nodes are visited from a queue (seeded order) and moved to the neighbouring
 *   community with the best gain {@code w(i,C) - γ k_i tot_C / 2m}; neighbours of a moved node are
 *   re-queued;</li>
 *   <li>refinement: inside every community, singletons merge greedily into well-connected
 *   sub-communities, so no community ends up internally disconnected;</li>
 *   <li>aggregation: refined sub-communities become the nodes of the next graph, starting from the
 *   unrefined assignment.</li>
 * </ol>
 * Iteration stops when nothing moves, when the modularity gain falls below
 * {@code minModularityGain}, or after {@code maxIterations}. Refinement merges greedily rather
 * than randomly, so results are reproducible but not guaranteed optimal.</p>
 */
public class LeidenClustering {
  private static final Logger LOGGER = LoggerFactory.getLogger(LeidenClustering.class);

  private static final int CANCEL_CHECK_INTERVAL = 256;
  private static final double EPSILON = 1e-12;

  private final double resolution;
  private final int maxIterations;
  private final double minModularityGain;
  private final long seed;

  public LeidenClustering(double resolution, int maxIterations, double minModularityGain, long seed) {
    if (resolution <= 0) throw new IllegalArgumentException("resolution must be positive");
    if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be at least 1");
    this.resolution = resolution;
    this.maxIterations = maxIterations;
    this.minModularityGain = minModularityGain;
    this.seed = seed;
  }

  public LeidenClustering(DiscoveryConfig config) {
    this(config.getResolution(), config.getMaxIterations(), config.getMinModularityGain(), config.getRandomSeed());
  }

  /**
   * Partitions {@code graph}. Isolated nodes end up as singleton communities.
   *
   * @throws CancellationException when {@code token} is cancelled mid-run
   */
  public Partition run(KnnGraph graph, CancellationToken token) {
    List<Long> ids = graph.nodes();
    int n = ids.size();
    int[] identity = new int[n];
    for (int i = 0; i < n; i++) identity[i] = i;
    if (n == 0 || graph.edgeCount() == 0) return new Partition(ids, identity);

    Random random = new Random(seed);
    WeightedGraph base = WeightedGraph.from(graph, ids);
    WeightedGraph current = base;
    // original node -> node of the current aggregate graph
    int[] nodeOf = identity.clone();
    // community of every node of the current graph
    int[] community = identity.clone();
    int[] finalMembership = identity.clone();
    double previous = base.modularity(identity, n, resolution);

    for (int iteration = 1; iteration <= maxIterations; iteration++) {
      checkCancelled(token);
      boolean moved = moveNodesFast(current, community, random, token);
      int communities = relabel(community);
      for (int i = 0; i < n; i++) finalMembership[i] = community[nodeOf[i]];
      double modularity = base.modularity(finalMembership, communities, resolution);
      LOGGER.debug("Leiden iteration {}: {} communities, modularity {}", iteration, communities, modularity);
      if (!moved || communities == current.nodeCount()) break;
      if (modularity - previous < minModularityGain) break;
      previous = modularity;

      checkCancelled(token);
      int[] refined = refine(current, community, communities);
      int refinedCount = relabel(refined);
      if (refinedCount == current.nodeCount()) break;
      WeightedGraph aggregate = current.aggregate(refined, refinedCount);
      int[] nextCommunity = new int[refinedCount];
      for (int v = 0; v < current.nodeCount(); v++) nextCommunity[refined[v]] = community[v];
      for (int i = 0; i < n; i++) nodeOf[i] = refined[nodeOf[i]];
      current = aggregate;
      community = nextCommunity;
    }
    return new Partition(ids, finalMembership);
  }

  /**
   * Queue-based local moving.
   *
   * @return whether any node changed community
   */
  private boolean moveNodesFast(WeightedGraph g, int[] community, Random random, CancellationToken token) {
    int n = g.nodeCount();
    double twoM = g.totalStrength();
    double[] tot = new double[n];
    for (int i = 0; i < n; i++) tot[community[i]] += g.strength(i);

    List<Integer> order = new ArrayList<>(n);
    for (int i = 0; i < n; i++) order.add(i);
    Collections.shuffle(order, random);
    ArrayDeque<Integer> queue = new ArrayDeque<>(order);
    boolean[] queued = new boolean[n];
    Arrays.fill(queued, true);

    double[] linkTo = new double[n];
    int[] touched = new int[n];
    boolean movedAny = false;
    int visits = 0;
    while (!queue.isEmpty()) {
      if (++visits % CANCEL_CHECK_INTERVAL == 0) checkCancelled(token);
      int v = queue.poll();
      queued[v] = false;
      int own = community[v];
      double kv = g.strength(v);

      int touchedCount = 0;
      for (int e = g.edgeStart(v); e < g.edgeEnd(v); e++) {
        int c = community[g.target(e)];
        if (linkTo[c] == 0) touched[touchedCount++] = c;
        linkTo[c] += g.weight(e);
      }
      tot[own] -= kv;
      int best = own;
      double bestGain = linkTo[own] - resolution * kv * tot[own] / twoM;
      for (int t = 0; t < touchedCount; t++) {
        int c = touched[t];
        double gain = linkTo[c] - resolution * kv * tot[c] / twoM;
        if (gain > bestGain + EPSILON || (Math.abs(gain - bestGain) <= EPSILON && best != own && c < best)) {
          best = c;
          bestGain = gain;
        }
      }
      // leaving for an empty community is never better than staying alone in the own one
      tot[best] += kv;
      for (int t = 0; t < touchedCount; t++) linkTo[touched[t]] = 0;
      linkTo[own] = 0;

      if (best != own) {
        community[v] = best;
        movedAny = true;
        for (int e = g.edgeStart(v); e < g.edgeEnd(v); e++) {
          int u = g.target(e);
          if (!queued[u] && community[u] != best) {
            queued[u] = true;
            queue.add(u);
          }
        }
      }
    }
    return movedAny;
  }

  /**
   * Splits every community into well-connected sub-communities. Nodes start as singletons and, in
   * index order, a still-singleton well-connected node joins the neighbouring well-connected
   * sub-community of its own community with the best non-negative gain.
   *
   * @return sub-community label per node (not compacted)
   */
  private int[] refine(WeightedGraph g, int[] community, int communities) {
    int n = g.nodeCount();
    double twoM = g.totalStrength();
    double[] communityStrength = new double[communities];
    for (int i = 0; i < n; i++) communityStrength[community[i]] += g.strength(i);

    int[] refined = new int[n];
    double[] subStrength = new double[n];
    // weight from the sub-community to the rest of its community
    double[] subExternal = new double[n];
    int[] subSize = new int[n];
    for (int i = 0; i < n; i++) {
      refined[i] = i;
      subStrength[i] = g.strength(i);
      subSize[i] = 1;
      double external = 0;
      for (int e = g.edgeStart(i); e < g.edgeEnd(i); e++) {
        if (community[g.target(e)] == community[i]) external += g.weight(e);
      }
      subExternal[i] = external;
    }

    double[] linkTo = new double[n];
    int[] touched = new int[n];
    for (int v = 0; v < n; v++) {
      if (subSize[refined[v]] != 1) continue;
      int c = community[v];
      double kv = g.strength(v);
      double kc = communityStrength[c];
      if (subExternal[v] < resolution * kv * (kc - kv) / twoM) continue;

      int touchedCount = 0;
      for (int e = g.edgeStart(v); e < g.edgeEnd(v); e++) {
        int u = g.target(e);
        if (community[u] != c || refined[u] == refined[v]) continue;
        int s = refined[u];
        if (linkTo[s] == 0) touched[touchedCount++] = s;
        linkTo[s] += g.weight(e);
      }
      int best = -1;
      double bestGain = 0;
      for (int t = 0; t < touchedCount; t++) {
        int s = touched[t];
        double ks = subStrength[s];
        if (subExternal[s] < resolution * ks * (kc - ks) / twoM) continue;
        double gain = linkTo[s] - resolution * kv * ks / twoM;
        if (gain >= -EPSILON && (best < 0 || gain > bestGain + EPSILON
            || (Math.abs(gain - bestGain) <= EPSILON && s < best))) {
          best = s;
          bestGain = gain;
        }
      }
      if (best >= 0) {
        int from = refined[v];
        refined[v] = best;
        subSize[from] = 0;
        subSize[best]++;
        subStrength[best] += kv;
        subStrength[from] = 0;
        subExternal[best] = subExternal[best] + subExternal[from] - 2 * linkTo[best];
        subExternal[from] = 0;
      }
      for (int t = 0; t < touchedCount; t++) linkTo[touched[t]] = 0;
    }
    return refined;
  }

  /**
   * Renumbers labels densely in order of first appearance.
   *
   * @return number of distinct labels
   */
  private static int relabel(int[] labels) {
    int[] mapping = new int[labels.length];
    Arrays.fill(mapping, -1);
    int next = 0;
    for (int i = 0; i < labels.length; i++) {
      if (mapping[labels[i]] < 0) mapping[labels[i]] = next++;
      labels[i] = mapping[labels[i]];
    }
    return next;
  }

  private static void checkCancelled(CancellationToken token) {
    if (token.isCancelled()) throw new CancellationException("clustering cancelled");
  }
}
