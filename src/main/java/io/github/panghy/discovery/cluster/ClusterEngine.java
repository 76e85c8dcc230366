package io.github.panghy.discovery.cluster;

import static io.github.panghy.discovery.util.Metrics.RECLUSTER_CANCELLED;
import static io.github.panghy.discovery.util.Metrics.RECLUSTER_DURATION_MS;
import static io.github.panghy.discovery.util.Metrics.RECLUSTER_RUN_COUNT;

import io.github.panghy.discovery.api.Cluster;
import io.github.panghy.discovery.api.Item;
import io.github.panghy.discovery.api.ItemStore;
import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.graph.GraphBuilder;
import io.github.panghy.discovery.graph.KnnGraph;
import io.github.panghy.discovery.util.Distances;
import io.github.panghy.discovery.util.Metrics;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups items into topic clusters and keeps cluster identity stable across passes.
 *
 * <p>A pass builds (or reuses) the similarity graph, runs Leiden, computes centroids, confidence
 * and labels, maps new communities onto previous clusters by centroid similarity, and commits the
 * result to the item store in one step. Matched clusters keep their id and custom label; new
 * communities get fresh ids (ids are never reused); previous clusters without a match are deleted
 * and their items become unclustered.</p>
 *
 * <p>All state changes happen under this instance's monitor; the expensive graph and Leiden work
 * of a pass runs outside it.</p>
 */
public class ClusterEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(ClusterEngine.class);

  private final DiscoveryConfig config;
  private final ItemStore store;
  private final GraphBuilder graphBuilder;
  private final LeidenClustering leiden;
  private final ClusterLabeler labeler;
  private final Attributes metricAttrs;

  private final TreeMap<Long, Cluster> clusters = new TreeMap<>();
  private KnnGraph graph;
  private long nextClusterId = 1;
  private int itemCountAtLastPass = -1;

  public ClusterEngine(DiscoveryConfig config, ItemStore store, GraphBuilder graphBuilder) {
    this.config = config;
    this.store = store;
    this.graphBuilder = graphBuilder;
    this.leiden = new LeidenClustering(config);
    this.labeler = new ClusterLabeler(config.getLabelTermCount());
    this.metricAttrs = Metrics.attrs(config.getMetricAttributes());
  }

  /**
   * Runs a full clustering pass and commits it unless {@code token} is cancelled first.
   *
   * @return the committed result, or {@link ClusteringResult#cancelled()}
   * @throws ClusteringException when the pass fails; the previous assignment is untouched
   */
  public ClusteringResult recluster(CancellationToken token) {
    Span span = Metrics.tracer().spanBuilder("discovery.recluster")
        .setSpanKind(SpanKind.INTERNAL)
        .startSpan();
    long t0 = System.nanoTime();
    RECLUSTER_RUN_COUNT.add(1, metricAttrs);
    try {
      List<Item> items = store.getAllItemsWithEmbeddings();
      span.setAttribute("items", items.size());
      checkCancelled(token);
      KnnGraph g = graphFor(items);
      Partition partition = leiden.run(g, token);
      double modularity = Partition.modularity(g, partition, config.getResolution());
      checkCancelled(token);
      List<Candidate> candidates = buildCandidates(items, partition);
      checkCancelled(token);
      ClusteringResult result = commit(items, candidates, g, modularity, token);
      if (result.isCancelled()) {
        RECLUSTER_CANCELLED.add(1, metricAttrs);
        LOGGER.info("Recluster superseded before commit");
      } else {
        LOGGER.info(
            "Reclustered {} items into {} clusters ({} retained, {} unclustered, modularity {})",
            items.size(), result.clusters().size(), result.retained(), result.unclustered(),
            String.format("%.4f", modularity));
      }
      return result;
    } catch (CancellationException e) {
      RECLUSTER_CANCELLED.add(1, metricAttrs);
      LOGGER.info("Recluster cancelled");
      return ClusteringResult.cancelled();
    } catch (OutOfMemoryError | RuntimeException e) {
      span.recordException(e);
      span.setStatus(StatusCode.ERROR);
      LOGGER.error("Recluster failed; keeping previous clusters", e);
      throw new ClusteringException("clustering pass failed", e);
    } finally {
      RECLUSTER_DURATION_MS.record((System.nanoTime() - t0) / 1_000_000.0, metricAttrs);
      span.end();
    }
  }

  /**
   * Whether a pass is due: never clustered while items exist, or the item count grew by more than
   * {@code reclusterGrowthThreshold} since the last pass.
   */
  public boolean shouldRecluster() {
    int count = store.getAllItemsWithEmbeddings().size();
    synchronized (this) {
      if (itemCountAtLastPass <= 0) return count > 0;
      return count > itemCountAtLastPass * (1.0 + config.getReclusterGrowthThreshold());
    }
  }

  /** Clusters ascending by id. */
  public synchronized List<Cluster> listClusters() {
    return new ArrayList<>(clusters.values());
  }

  public synchronized Optional<Cluster> getCluster(long id) {
    return Optional.ofNullable(clusters.get(id));
  }

  /**
   * Moves every member of {@code fromId} into {@code intoId} and deletes {@code fromId}.
   *
   * @throws IllegalArgumentException for unknown or identical ids
   */
  public synchronized Cluster mergeClusters(long intoId, long fromId) {
    if (intoId == fromId) throw new IllegalArgumentException("cannot merge cluster " + intoId + " into itself");
    Cluster into = require(intoId);
    Cluster from = require(fromId);
    SortedSet<Long> members = new TreeSet<>(into.memberIds());
    members.addAll(from.memberIds());
    Cluster merged = withMembers(into, members);
    clusters.remove(fromId);
    clusters.put(intoId, merged);
    for (long id : from.memberIds()) store.updateClusterAssignment(id, intoId);
    persist();
    LOGGER.debug("Merged cluster {} into {}", fromId, intoId);
    return merged;
  }

  /**
   * Moves {@code itemIds} out of cluster {@code id} into a new cluster.
   *
   * @return the new cluster
   * @throws IllegalArgumentException when the id is unknown or {@code itemIds} is not a non-empty
   *                                  proper subset of its members
   */
  public synchronized Cluster splitCluster(long id, Set<Long> itemIds) {
    Cluster source = require(id);
    if (itemIds.isEmpty()) throw new IllegalArgumentException("itemIds must not be empty");
    if (!source.memberIds().containsAll(itemIds)) {
      throw new IllegalArgumentException("itemIds must all be members of cluster " + id);
    }
    if (itemIds.size() == source.memberIds().size()) {
      throw new IllegalArgumentException("itemIds must leave at least one member in cluster " + id);
    }
    SortedSet<Long> remaining = new TreeSet<>(source.memberIds());
    remaining.removeAll(itemIds);
    Cluster kept = withMembers(source, remaining);

    Map<Long, Item> split = members(itemIds);
    float[] centroid = split.isEmpty() ? source.centroid() : Distances.mean(embeddings(split.values()));
    long newId = nextClusterId++;
    String label = uniqueLabel(newId, labeler.label(split.values()), centroid);
    Cluster created = Cluster.builder()
        .id(newId)
        .label(label)
        .centroid(centroid)
        .memberIds(new TreeSet<>(itemIds))
        .confidenceScore(confidence(centroid, split.values()))
        .updatedAt(now())
        .build();
    clusters.put(id, kept);
    clusters.put(newId, created);
    for (long itemId : itemIds) store.updateClusterAssignment(itemId, newId);
    persist();
    LOGGER.debug("Split {} items out of cluster {} into {}", itemIds.size(), id, newId);
    return created;
  }

  /**
   * Removes an item from its cluster; a cluster left empty is deleted.
   *
   * @return whether the item was clustered
   */
  public synchronized boolean evictItem(long itemId) {
    boolean evicted = evictLocked(itemId);
    if (evicted) {
      store.updateClusterAssignment(itemId, null);
      persist();
    }
    return evicted;
  }

  /**
   * Sets or clears ({@code null} or blank) the user label of a cluster. Custom labels survive
   * reclustering as long as the cluster keeps its id.
   */
  public synchronized Cluster renameCluster(long id, String customLabel) {
    Cluster c = require(id);
    String label = customLabel == null || customLabel.isBlank() ? null : customLabel.trim();
    Cluster renamed = c.toBuilder().customLabel(label).updatedAt(now()).build();
    clusters.put(id, renamed);
    persist();
    return renamed;
  }

  /** Adds a newly indexed item to the incrementally maintained graph. */
  public synchronized void onItemAdded(Item item) {
    if (graph == null || !item.hasEmbedding()) return;
    graphBuilder.addNode(graph, item, config.getGraphNeighbors(), graph::containsNode);
  }

  /** Drops a deleted item from the graph and from its cluster. */
  public synchronized void onItemRemoved(long itemId) {
    if (graph != null) graph.removeNode(itemId);
    // the item row is gone; only the cluster table needs persisting
    if (evictLocked(itemId)) persist();
  }

  /** Forces the next pass to rebuild the similarity graph from the index. */
  public synchronized void invalidateGraph() {
    graph = null;
  }

  /**
   * Restores clusters from the persisted table. Membership is re-derived from the items' cluster
   * references: clusters without members are dropped and items pointing at unknown clusters are
   * unassigned.
   */
  public synchronized void restore(List<Cluster> saved) {
    Map<Long, Cluster> byId = new TreeMap<>();
    for (Cluster c : saved) byId.put(c.id(), c);
    Map<Long, SortedSet<Long>> membership = new TreeMap<>();
    int withEmbeddings = 0;
    for (Item item : store.getAllItems()) {
      if (item.hasEmbedding()) withEmbeddings++;
      if (item.clusterId() == null) continue;
      if (byId.containsKey(item.clusterId()) && item.hasEmbedding()) {
        membership.computeIfAbsent(item.clusterId(), k -> new TreeSet<>()).add(item.id());
      } else {
        LOGGER.warn("Item {} references missing cluster {}; unassigning", item.id(), item.clusterId());
        store.updateClusterAssignment(item.id(), null);
      }
    }
    clusters.clear();
    long maxId = 0;
    for (Cluster c : byId.values()) {
      maxId = Math.max(maxId, c.id());
      SortedSet<Long> members = membership.get(c.id());
      if (members == null) continue;
      clusters.put(c.id(), withMembers(c, members, c.updatedAt()));
    }
    nextClusterId = Math.max(nextClusterId, maxId + 1);
    itemCountAtLastPass = clusters.isEmpty() ? -1 : withEmbeddings;
    graph = null;
    persist();
    LOGGER.info("Restored {} clusters ({} dropped)", clusters.size(), byId.size() - clusters.size());
  }

  // Pass internals.

  private record Candidate(SortedSet<Long> members, float[] centroid, double confidence, String label) {}

  private KnnGraph graphFor(List<Item> items) {
    synchronized (this) {
      if (graph != null && graph.nodeCount() == items.size()) {
        boolean same = true;
        for (Item item : items) {
          if (!graph.containsNode(item.id())) {
            same = false;
            break;
          }
        }
        if (same) return graph.copy();
      }
    }
    return graphBuilder.buildGraph(items, config.getGraphNeighbors());
  }

  private List<Candidate> buildCandidates(List<Item> items, Partition partition) {
    Map<Long, Item> byId = new HashMap<>();
    for (Item item : items) byId.put(item.id(), item);
    List<Candidate> out = new ArrayList<>();
    for (SortedSet<Long> community : partition.communities()) {
      if (community.size() < config.getMinClusterSize()) continue;
      List<Item> members = new ArrayList<>(community.size());
      for (long id : community) members.add(byId.get(id));
      float[] centroid = Distances.mean(embeddings(members));
      out.add(new Candidate(community, centroid, confidence(centroid, members), labeler.label(members)));
    }
    return out;
  }

  private synchronized ClusteringResult commit(
      List<Item> items, List<Candidate> candidates, KnnGraph g, double modularity, CancellationToken token) {
    if (token.isCancelled()) return ClusteringResult.cancelled();
    Set<Long> live = new HashSet<>();
    for (Item item : store.getAllItems()) live.add(item.id());

    // greedy one-to-one matching by centroid similarity, best pairs first
    List<double[]> pairs = new ArrayList<>();
    List<Cluster> previous = new ArrayList<>(clusters.values());
    for (int p = 0; p < previous.size(); p++) {
      for (int c = 0; c < candidates.size(); c++) {
        double sim = previous.get(p).similarity(candidates.get(c).centroid());
        if (sim >= config.getStabilityThreshold()) pairs.add(new double[] {sim, p, c});
      }
    }
    pairs.sort((a, b) -> {
      int cmp = Double.compare(b[0], a[0]);
      if (cmp != 0) return cmp;
      cmp = Double.compare(a[1], b[1]);
      return cmp != 0 ? cmp : Double.compare(a[2], b[2]);
    });
    Map<Integer, Cluster> matchOf = new HashMap<>();
    Set<Integer> usedPrevious = new HashSet<>();
    for (double[] pair : pairs) {
      int p = (int) pair[1];
      int c = (int) pair[2];
      if (usedPrevious.contains(p) || matchOf.containsKey(c)) continue;
      usedPrevious.add(p);
      matchOf.put(c, previous.get(p));
    }

    Instant now = now();
    Map<Long, Cluster> next = new TreeMap<>();
    Map<Long, String> generated = new TreeMap<>();
    Map<Long, float[]> centroids = new HashMap<>();
    Set<String> reserved = new HashSet<>();
    Map<Long, Long> assignment = new HashMap<>();
    for (int c = 0; c < candidates.size(); c++) {
      Candidate cand = candidates.get(c);
      SortedSet<Long> members = new TreeSet<>();
      for (long id : cand.members()) {
        if (live.contains(id)) members.add(id);
      }
      if (members.isEmpty()) continue;
      float[] centroid = cand.centroid();
      double confidence = cand.confidence();
      String label = cand.label();
      if (members.size() < cand.members().size()) {
        // members deleted while the pass ran
        Map<Long, Item> survivors = members(members);
        if (survivors.isEmpty()) continue;
        members = new TreeSet<>(survivors.keySet());
        Collection<Item> kept = survivors.values();
        centroid = Distances.mean(embeddings(kept));
        confidence = confidence(centroid, kept);
        label = labeler.label(kept);
      }
      Cluster prior = matchOf.get(c);
      long id = prior != null ? prior.id() : nextClusterId++;
      String customLabel = prior != null ? prior.customLabel() : null;
      Instant updatedAt = prior != null && prior.memberIds().equals(members) && Objects.equals(prior.label(), label)
          ? prior.updatedAt()
          : now;
      next.put(id, Cluster.builder()
          .id(id)
          .label(label)
          .customLabel(customLabel)
          .centroid(centroid)
          .memberIds(members)
          .confidenceScore(confidence)
          .updatedAt(updatedAt)
          .build());
      if (customLabel != null) {
        reserved.add(customLabel);
      } else {
        generated.put(id, label);
      }
      centroids.put(id, centroid);
      for (long member : members) assignment.put(member, id);
    }
    Map<Long, String> unique = ClusterLabeler.disambiguate(generated, centroids, reserved);
    for (var e : unique.entrySet()) {
      Cluster c = next.get(e.getKey());
      if (!c.label().equals(e.getValue())) next.put(e.getKey(), c.toBuilder().label(e.getValue()).build());
    }

    int unclustered = 0;
    for (Item item : items) {
      if (!live.contains(item.id())) continue;
      Long target = assignment.get(item.id());
      if (target == null) unclustered++;
      Long current = store.getItem(item.id()).map(Item::clusterId).orElse(null);
      if (target == null ? current != null : !target.equals(current)) {
        store.updateClusterAssignment(item.id(), target);
      }
    }
    clusters.clear();
    clusters.putAll(next);
    store.replaceClusters(new ArrayList<>(next.values()));
    itemCountAtLastPass = items.size();
    graph = g;
    return new ClusteringResult(
        ClusteringResult.Status.COMPLETED, new ArrayList<>(next.values()), unclustered, matchOf.size(), modularity);
  }

  // Helpers; callers hold the monitor.

  private boolean evictLocked(long itemId) {
    for (Cluster c : clusters.values()) {
      if (!c.memberIds().contains(itemId)) continue;
      SortedSet<Long> remaining = new TreeSet<>(c.memberIds());
      remaining.remove(itemId);
      if (remaining.isEmpty()) {
        clusters.remove(c.id());
      } else {
        clusters.put(c.id(), withMembers(c, remaining));
      }
      return true;
    }
    return false;
  }

  private Cluster withMembers(Cluster base, SortedSet<Long> memberIds) {
    return withMembers(base, memberIds, now());
  }

  /** Recomputes centroid and confidence for a new member set, keeping id and labels. */
  private Cluster withMembers(Cluster base, SortedSet<Long> memberIds, Instant updatedAt) {
    Map<Long, Item> members = members(memberIds);
    if (members.isEmpty()) {
      return base.toBuilder().memberIds(memberIds).updatedAt(updatedAt).build();
    }
    float[] centroid = Distances.mean(embeddings(members.values()));
    return base.toBuilder()
        .memberIds(memberIds)
        .centroid(centroid)
        .confidenceScore(confidence(centroid, members.values()))
        .updatedAt(updatedAt)
        .build();
  }

  /** Members that still exist and have an embedding. */
  private Map<Long, Item> members(Collection<Long> ids) {
    Map<Long, Item> out = new TreeMap<>();
    for (long id : ids) {
      store.getItem(id).filter(Item::hasEmbedding).ifPresent(item -> out.put(id, item));
    }
    return out;
  }

  private String uniqueLabel(long id, String label, float[] centroid) {
    Set<String> taken = new HashSet<>();
    for (Cluster c : clusters.values()) taken.add(c.displayLabel());
    if (!taken.contains(label)) return label;
    return ClusterLabeler.disambiguate(Map.of(id, label), Map.of(id, centroid), taken).get(id);
  }

  /** Mean member-to-centroid cosine, clamped to [0, 1]; 1 for a single member. */
  static double confidence(float[] centroid, Collection<Item> members) {
    if (members.size() <= 1) return 1.0;
    double sum = 0;
    double centroidNorm = Distances.norm(centroid);
    for (Item item : members) {
      sum += Distances.cosine(centroid, centroidNorm, item.embedding(), Distances.norm(item.embedding()));
    }
    return Math.max(0.0, Math.min(1.0, sum / members.size()));
  }

  private static List<float[]> embeddings(Collection<Item> items) {
    List<float[]> out = new ArrayList<>(items.size());
    for (Item item : items) out.add(item.embedding());
    return out;
  }

  private Cluster require(long id) {
    Cluster c = clusters.get(id);
    if (c == null) throw new IllegalArgumentException("unknown cluster " + id);
    return c;
  }

  private void persist() {
    store.replaceClusters(new ArrayList<>(clusters.values()));
  }

  private Instant now() {
    return config.getInstantSource().instant();
  }

  private static void checkCancelled(CancellationToken token) {
    if (token.isCancelled()) throw new CancellationException("clustering cancelled");
  }
}
