package io.github.panghy.discovery.index;

import static io.github.panghy.discovery.util.Metrics.INDEX_QUERY_DURATION_MS;

import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.util.Distances;
import io.github.panghy.discovery.util.Metrics;
import io.opentelemetry.api.common.Attributes;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory hierarchical navigable small world graph over item embeddings.
 *
 * <p>Nodes live in internal slots; removed nodes become tombstones until {@link #compact()} drops
 * them. Every live node that linked to a removed node is re-linked to the removed node's
 * neighbours, so search quality does not decay with deletes. Level assignment uses a seeded
 * {@link Random} and all ties are broken by item id, so the same seed and insertion order always
 * produce the same graph.</p>
 *
 * <p>Thread-safe: queries share a read lock, mutations take the write lock.</p>
 */
public class HnswIndex {
  private static final Logger LOGGER = LoggerFactory.getLogger(HnswIndex.class);

  static final class Node {
    final long id;
    final float[] vector;
    final double norm;
    final int level;
    final int[][] links;
    boolean deleted;

    Node(long id, float[] vector, int level) {
      this.id = id;
      this.vector = vector;
      this.norm = Distances.norm(vector);
      this.level = level;
      this.links = new int[level + 1][];
      for (int l = 0; l <= level; l++) links[l] = new int[0];
    }
  }

  private final DiscoveryConfig config;
  private final int dimension;
  private final int m;
  private final int maxDegreeLayer0;
  private final double levelMultiplier;
  private final Attributes metricAttrs;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private final List<Node> nodes = new ArrayList<>();
  private final Map<Long, Integer> liveSlots = new HashMap<>();
  private Random random;
  private int entry = -1;
  private int maxLevel = -1;

  public HnswIndex(DiscoveryConfig config) {
    this.config = config;
    this.dimension = config.getDimension();
    this.m = config.getM();
    this.maxDegreeLayer0 = 2 * m;
    this.levelMultiplier = 1.0 / Math.log(m);
    this.metricAttrs = Metrics.attrs(config.getMetricAttributes());
    this.random = new Random(config.getRandomSeed());
  }

  public DiscoveryConfig getConfig() {
    return config;
  }

  /**
   * Adds or replaces the vector for {@code id}. An existing entry is removed first, so an id never
   * has two live nodes.
   *
   * @throws DimensionMismatchException if {@code vector.length} differs from the index dimension
   */
  public void insert(long id, float[] vector) {
    checkDimension(vector);
    lock.writeLock().lock();
    try {
      if (liveSlots.containsKey(id)) removeLocked(id);
      insertLocked(id, vector.clone());
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Removes {@code id} and repairs the links that pointed at it.
   *
   * @return whether the id was live
   */
  public boolean remove(long id) {
    lock.writeLock().lock();
    try {
      return removeLocked(id);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Returns up to {@code k} nearest live items, most similar first (ties by ascending id).
   *
   * @throws DimensionMismatchException if {@code query.length} differs from the index dimension
   */
  public List<Neighbor> query(float[] query, int k) {
    checkDimension(query);
    long start = System.nanoTime();
    lock.readLock().lock();
    try {
      if (entry < 0 || k <= 0) return List.of();
      double queryNorm = Distances.norm(query);
      int ep = entry;
      for (int l = maxLevel; l > 0; l--) {
        ep = greedyClosest(query, queryNorm, ep, l);
      }
      List<SearchCandidate> found = searchLayer(query, queryNorm, List.of(ep), Math.max(config.getEfSearch(), k), 0);
      List<Neighbor> out = new ArrayList<>(Math.min(k, found.size()));
      for (SearchCandidate c : found) {
        if (out.size() >= k) break;
        out.add(new Neighbor(c.getItemId(), toSimilarity(c.getDistance())));
      }
      return out;
    } finally {
      lock.readLock().unlock();
      INDEX_QUERY_DURATION_MS.record((System.nanoTime() - start) / 1_000_000.0, metricAttrs);
    }
  }

  /**
   * Physically drops tombstones and renumbers internal slots.
   *
   * @return number of tombstones purged
   */
  public int compact() {
    lock.writeLock().lock();
    try {
      int purged = nodes.size() - liveSlots.size();
      if (purged == 0) return 0;
      int[] remap = new int[nodes.size()];
      List<Node> kept = new ArrayList<>(liveSlots.size());
      for (int s = 0; s < nodes.size(); s++) {
        Node n = nodes.get(s);
        if (n.deleted) {
          remap[s] = -1;
        } else {
          remap[s] = kept.size();
          kept.add(n);
        }
      }
      for (Node n : kept) {
        for (int l = 0; l <= n.level; l++) {
          n.links[l] = remapLinks(n.links[l], remap);
        }
      }
      nodes.clear();
      nodes.addAll(kept);
      liveSlots.clear();
      for (int s = 0; s < nodes.size(); s++) liveSlots.put(nodes.get(s).id, s);
      entry = entry < 0 ? -1 : remap[entry];
      LOGGER.debug("Compacted index: purged {} tombstones, {} live nodes", purged, nodes.size());
      return purged;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public boolean contains(long id) {
    lock.readLock().lock();
    try {
      return liveSlots.containsKey(id);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Number of live entries. */
  public int size() {
    lock.readLock().lock();
    try {
      return liveSlots.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  public int tombstoneCount() {
    lock.readLock().lock();
    try {
      return nodes.size() - liveSlots.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Live ids in ascending order. */
  public List<Long> ids() {
    lock.readLock().lock();
    try {
      List<Long> ids = new ArrayList<>(liveSlots.keySet());
      Collections.sort(ids);
      return ids;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** A copy of the stored vector for a live id. */
  public Optional<float[]> vector(long id) {
    lock.readLock().lock();
    try {
      Integer slot = liveSlots.get(id);
      return slot == null ? Optional.empty() : Optional.of(nodes.get(slot).vector.clone());
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Out-neighbour ids of a live node at {@code layer}, in link order; empty when absent.
   */
  public List<Long> links(long id, int layer) {
    lock.readLock().lock();
    try {
      Integer slot = liveSlots.get(id);
      if (slot == null) return List.of();
      Node n = nodes.get(slot);
      if (layer > n.level) return List.of();
      List<Long> out = new ArrayList<>(n.links[layer].length);
      for (int s : n.links[layer]) out.add(nodes.get(s).id);
      return out;
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Item id of the entry point, empty for an index without live nodes. */
  public Optional<Long> entryPoint() {
    lock.readLock().lock();
    try {
      return entry < 0 ? Optional.empty() : Optional.of(nodes.get(entry).id);
    } finally {
      lock.readLock().unlock();
    }
  }

  // Snapshot support.

  /** Runs {@code reader} under the read lock with a consistent view of the internal state. */
  <T> T readState(StateReader<T> reader) {
    lock.readLock().lock();
    try {
      return reader.read(Collections.unmodifiableList(nodes), entry, maxLevel);
    } finally {
      lock.readLock().unlock();
    }
  }

  @FunctionalInterface
  interface StateReader<T> {
    T read(List<Node> nodes, int entry, int maxLevel);
  }

  /** Rebuilds an index from decoded snapshot state. */
  static HnswIndex restore(DiscoveryConfig config, List<Node> restored, int entry, int maxLevel) {
    HnswIndex index = new HnswIndex(config);
    index.nodes.addAll(restored);
    for (int s = 0; s < restored.size(); s++) {
      Node n = restored.get(s);
      if (!n.deleted) index.liveSlots.put(n.id, s);
    }
    index.entry = entry;
    index.maxLevel = maxLevel;
    // continue with a seed distinct from a fresh index so new levels do not repeat the prefix
    index.random = new Random(config.getRandomSeed() ^ restored.size());
    return index;
  }

  // Internals; callers hold the write lock.

  private void insertLocked(long id, float[] vector) {
    int level = randomLevel();
    Node node = new Node(id, vector, level);
    int slot = nodes.size();
    nodes.add(node);
    liveSlots.put(id, slot);
    if (entry < 0) {
      entry = slot;
      maxLevel = level;
      return;
    }
    int ep = entry;
    for (int l = maxLevel; l > level; l--) {
      ep = greedyClosest(vector, node.norm, ep, l);
    }
    List<Integer> entryPoints = List.of(ep);
    for (int l = Math.min(level, maxLevel); l >= 0; l--) {
      List<SearchCandidate> candidates = searchLayer(vector, node.norm, entryPoints, config.getEfConstruction(), l);
      candidates.removeIf(c -> c.getSlot() == slot);
      List<SearchCandidate> selected = NeighborSelector.select(candidates, maxDegree(l), this::distance);
      node.links[l] = toSlots(selected);
      for (SearchCandidate s : selected) {
        addLink(s.getSlot(), slot, l);
      }
      if (!candidates.isEmpty()) {
        List<Integer> next = new ArrayList<>(candidates.size());
        for (SearchCandidate c : candidates) next.add(c.getSlot());
        entryPoints = next;
      }
    }
    if (level > maxLevel) {
      entry = slot;
      maxLevel = level;
    }
  }

  private boolean removeLocked(long id) {
    Integer boxed = liveSlots.remove(id);
    if (boxed == null) return false;
    int slot = boxed;
    Node removed = nodes.get(slot);
    removed.deleted = true;
    for (int l = 0; l <= removed.level; l++) {
      int[] replacements = liveOnly(removed.links[l]);
      for (int s = 0; s < nodes.size(); s++) {
        Node n = nodes.get(s);
        if (n.deleted || n.level < l || !containsSlot(n.links[l], slot)) continue;
        relink(s, l, slot, replacements);
      }
      removed.links[l] = new int[0];
    }
    if (entry == slot) electEntryPoint();
    return true;
  }

  /** Drops {@code removedSlot} from a node's links and offers the removed node's neighbours. */
  private void relink(int slot, int layer, int removedSlot, int[] replacements) {
    Node n = nodes.get(slot);
    Map<Integer, SearchCandidate> pool = new LinkedHashMap<>();
    for (int s : n.links[layer]) {
      if (s != removedSlot && !nodes.get(s).deleted) pool.put(s, candidate(slot, s));
    }
    for (int s : replacements) {
      if (s != slot && !pool.containsKey(s)) pool.put(s, candidate(slot, s));
    }
    List<SearchCandidate> sorted = new ArrayList<>(pool.values());
    sorted.sort(SearchCandidate.NEAREST_FIRST);
    n.links[layer] = toSlots(NeighborSelector.select(sorted, maxDegree(layer), this::distance));
  }

  private void electEntryPoint() {
    int best = -1;
    for (int s = 0; s < nodes.size(); s++) {
      Node n = nodes.get(s);
      if (n.deleted) continue;
      if (best < 0) {
        best = s;
        continue;
      }
      Node b = nodes.get(best);
      if (n.level > b.level || (n.level == b.level && n.id < b.id)) best = s;
    }
    entry = best;
    maxLevel = best < 0 ? -1 : nodes.get(best).level;
  }

  private void addLink(int from, int to, int layer) {
    Node n = nodes.get(from);
    int[] current = n.links[layer];
    if (containsSlot(current, to)) return;
    if (current.length < maxDegree(layer)) {
      int[] grown = new int[current.length + 1];
      System.arraycopy(current, 0, grown, 0, current.length);
      grown[current.length] = to;
      n.links[layer] = grown;
      return;
    }
    List<SearchCandidate> pool = new ArrayList<>(current.length + 1);
    for (int s : current) pool.add(candidate(from, s));
    pool.add(candidate(from, to));
    pool.sort(SearchCandidate.NEAREST_FIRST);
    n.links[layer] = toSlots(NeighborSelector.select(pool, maxDegree(layer), this::distance));
  }

  // Search; callers hold either lock.

  private int greedyClosest(float[] query, double queryNorm, int start, int layer) {
    int current = start;
    float currentDist = distance(query, queryNorm, nodes.get(current));
    boolean improved = true;
    while (improved) {
      improved = false;
      Node n = nodes.get(current);
      if (n.level < layer) break;
      for (int s : n.links[layer]) {
        Node candidate = nodes.get(s);
        float d = distance(query, queryNorm, candidate);
        if (d < currentDist || (d == currentDist && candidate.id < nodes.get(current).id)) {
          current = s;
          currentDist = d;
          improved = true;
        }
      }
    }
    return current;
  }

  /**
   * Beam search on one layer. Tombstones are expanded but never returned.
   *
   * @return live candidates, nearest first, at most {@code ef}
   */
  private List<SearchCandidate> searchLayer(
      float[] query, double queryNorm, List<Integer> entryPoints, int ef, int layer) {
    BitSet visited = new BitSet(nodes.size());
    PriorityQueue<SearchCandidate> frontier = new PriorityQueue<>(SearchCandidate.NEAREST_FIRST);
    PriorityQueue<SearchCandidate> results = new PriorityQueue<>(SearchCandidate.FARTHEST_FIRST);
    for (int ep : entryPoints) {
      if (visited.get(ep)) continue;
      visited.set(ep);
      Node n = nodes.get(ep);
      SearchCandidate c = new SearchCandidate(ep, n.id, distance(query, queryNorm, n));
      frontier.add(c);
      offer(results, c, n, ef);
    }
    while (!frontier.isEmpty()) {
      SearchCandidate current = frontier.poll();
      if (results.size() >= ef && current.compareTo(results.peek()) > 0) break;
      Node n = nodes.get(current.getSlot());
      if (n.level < layer) continue;
      for (int s : n.links[layer]) {
        if (visited.get(s)) continue;
        visited.set(s);
        Node next = nodes.get(s);
        SearchCandidate c = new SearchCandidate(s, next.id, distance(query, queryNorm, next));
        if (results.size() < ef || c.compareTo(results.peek()) < 0) {
          frontier.add(c);
          offer(results, c, next, ef);
        }
      }
    }
    List<SearchCandidate> out = new ArrayList<>(results);
    out.sort(SearchCandidate.NEAREST_FIRST);
    return out;
  }

  private static void offer(PriorityQueue<SearchCandidate> results, SearchCandidate c, Node n, int ef) {
    if (n.deleted) return;
    results.add(c);
    if (results.size() > ef) results.poll();
  }

  // Distances.

  private float distance(float[] query, double queryNorm, Node n) {
    if (config.getMetric() == DiscoveryConfig.Metric.INNER_PRODUCT) {
      return (float) -Distances.dot(query, n.vector);
    }
    return (float) (1.0 - Distances.cosine(query, queryNorm, n.vector, n.norm));
  }

  private float distance(int slotA, int slotB) {
    Node a = nodes.get(slotA);
    return distance(a.vector, a.norm, nodes.get(slotB));
  }

  private SearchCandidate candidate(int base, int slot) {
    return new SearchCandidate(slot, nodes.get(slot).id, distance(base, slot));
  }

  private double toSimilarity(float distance) {
    return config.getMetric() == DiscoveryConfig.Metric.INNER_PRODUCT ? -distance : 1.0 - distance;
  }

  // Helpers.

  private int randomLevel() {
    double u = 1.0 - random.nextDouble();
    return (int) Math.floor(-Math.log(u) * levelMultiplier);
  }

  private int maxDegree(int layer) {
    return layer == 0 ? maxDegreeLayer0 : m;
  }

  private void checkDimension(float[] vector) {
    if (vector.length != dimension) throw new DimensionMismatchException(dimension, vector.length);
  }

  private int[] liveOnly(int[] slots) {
    int[] out = new int[slots.length];
    int n = 0;
    for (int s : slots) {
      if (!nodes.get(s).deleted) out[n++] = s;
    }
    int[] trimmed = new int[n];
    System.arraycopy(out, 0, trimmed, 0, n);
    return trimmed;
  }

  private static int[] toSlots(List<SearchCandidate> candidates) {
    int[] out = new int[candidates.size()];
    for (int i = 0; i < out.length; i++) out[i] = candidates.get(i).getSlot();
    return out;
  }

  private static boolean containsSlot(int[] slots, int slot) {
    for (int s : slots) {
      if (s == slot) return true;
    }
    return false;
  }

  private static int[] remapLinks(int[] slots, int[] remap) {
    int[] out = new int[slots.length];
    int n = 0;
    for (int s : slots) {
      if (remap[s] >= 0) out[n++] = remap[s];
    }
    int[] trimmed = new int[n];
    System.arraycopy(out, 0, trimmed, 0, n);
    return trimmed;
  }
}
