package io.github.panghy.discovery.graph;

import static io.github.panghy.discovery.util.Metrics.STALE_SKIPPED;

import io.github.panghy.discovery.api.Item;
import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.index.HnswIndex;
import io.github.panghy.discovery.index.Neighbor;
import io.github.panghy.discovery.util.Metrics;
import io.opentelemetry.api.common.Attributes;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the k-nearest-neighbour similarity graph the clustering runs on.
 *
 * <p>Neighbours come from the vector index rather than a pairwise scan. Edge weights are the
 * index similarities; non-positive similarities produce no edge. Index hits for items that are no
 * longer live are skipped and counted.</p>
 */
public final class GraphBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger(GraphBuilder.class);

  private final Supplier<HnswIndex> index;
  private final Attributes metricAttrs;

  /**
   * @param index supplies the current index; read on every call so a swapped-in rebuild is used
   */
  public GraphBuilder(Supplier<HnswIndex> index, DiscoveryConfig config) {
    this.index = index;
    this.metricAttrs = Metrics.attrs(config.getMetricAttributes());
  }

  /**
   * Builds the graph over every item that has an embedding.
   *
   * @param items live items
   * @param k     neighbours per node
   */
  public KnnGraph buildGraph(List<Item> items, int k) {
    Set<Long> live = new HashSet<>();
    for (Item item : items) {
      if (item.hasEmbedding()) live.add(item.id());
    }
    KnnGraph graph = new KnnGraph();
    int stale = 0;
    for (Item item : items) {
      if (!item.hasEmbedding()) continue;
      graph.addNode(item.id());
      stale += link(graph, item, k, live::contains);
    }
    if (stale > 0) {
      LOGGER.warn("Skipped {} stale index entries while building the similarity graph", stale);
    }
    LOGGER.debug("Built similarity graph: {}", graph);
    return graph;
  }

  /**
   * Adds one item and its edges to an existing graph. An item already in the graph is re-linked
   * from its current embedding: its previous edges are dropped first.
   *
   * @param isLive whether an index hit still refers to a live graph member
   * @return whether the item was added (items without an embedding are not)
   */
  public boolean addNode(KnnGraph graph, Item item, int k, Predicate<Long> isLive) {
    if (!item.hasEmbedding()) return false;
    graph.removeNode(item.id());
    graph.addNode(item.id());
    int stale = link(graph, item, k, isLive);
    if (stale > 0) LOGGER.debug("Skipped {} stale index entries linking item {}", stale, item.id());
    return true;
  }

  private int link(KnnGraph graph, Item item, int k, Predicate<Long> isLive) {
    List<Neighbor> hits = index.get().query(item.embedding(), k + 1);
    int stale = 0;
    int linked = 0;
    for (Neighbor n : hits) {
      if (linked >= k) break;
      if (n.itemId() == item.id()) continue;
      if (!isLive.test(n.itemId())) {
        stale++;
        continue;
      }
      graph.addEdge(item.id(), n.itemId(), n.similarity());
      linked++;
    }
    if (stale > 0) STALE_SKIPPED.add(stale, metricAttrs);
    return stale;
  }
}
