package io.github.panghy.discovery;

import static io.github.panghy.discovery.util.Metrics.REBUILD_DURATION_MS;

import io.github.panghy.discovery.api.Cluster;
import io.github.panghy.discovery.api.Item;
import io.github.panghy.discovery.api.ItemStore;
import io.github.panghy.discovery.api.ItemStoreListener;
import io.github.panghy.discovery.api.SearchFilters;
import io.github.panghy.discovery.api.TextEncoder;
import io.github.panghy.discovery.cluster.ClusterEngine;
import io.github.panghy.discovery.cluster.ClusteringResult;
import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.embed.EmbeddingService;
import io.github.panghy.discovery.graph.GraphBuilder;
import io.github.panghy.discovery.index.DimensionMismatchException;
import io.github.panghy.discovery.index.HnswIndex;
import io.github.panghy.discovery.index.IndexSnapshots;
import io.github.panghy.discovery.index.SnapshotCorruptedException;
import io.github.panghy.discovery.search.HybridSearchEngine;
import io.github.panghy.discovery.search.ScoredItem;
import io.github.panghy.discovery.tasks.BackgroundTaskPool;
import io.github.panghy.discovery.tasks.IndexingReport;
import io.github.panghy.discovery.tasks.IndexingService;
import io.github.panghy.discovery.util.Metrics;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the discovery engine: semantic and keyword search over an item library plus
 * automatic topic clustering.
 *
 * <p>On {@link #create} the engine loads the index snapshot (when configured), reconciles it
 * with the item store, or rebuilds it from the stored embeddings; restores the persisted clusters;
 * and subscribes to store changes so the index and the similarity graph follow adds and removes.
 * Expensive work (rebuilds, reclustering, embedding batches) runs on a background pool.</p>
 *
 * <p>Example usage:
 * <pre>{@code
 * try (DiscoveryEngine engine = DiscoveryEngine.create(config, store, encoder)) {
 *   engine.indexPending().join();
 *   engine.recluster().join();
 *   List<Item> hits = engine.search("sourdough baking", SearchFilters.NONE);
 * }
 * }</pre>
 */
public final class DiscoveryEngine implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(DiscoveryEngine.class);

  private final DiscoveryConfig config;
  private final ItemStore store;
  private final BackgroundTaskPool pool;
  private final AtomicReference<HnswIndex> index = new AtomicReference<>();
  private final EmbeddingService embeddings;
  private final ClusterEngine clusters;
  private final HybridSearchEngine searchEngine;
  private final IndexingService indexing;
  private final ItemStoreListener listener;
  private final Attributes metricAttrs;

  private DiscoveryEngine(DiscoveryConfig config, ItemStore store, TextEncoder encoder) {
    this.config = config;
    this.store = store;
    this.pool = new BackgroundTaskPool(config.getBackgroundThreads(), config.getSearchThreads());
    this.metricAttrs = Metrics.attrs(config.getMetricAttributes());
    this.embeddings = new EmbeddingService(config, encoder, pool.executor());
    GraphBuilder graphBuilder = new GraphBuilder(index::get, config);
    this.clusters = new ClusterEngine(config, store, graphBuilder);
    this.searchEngine = new HybridSearchEngine(config, store, embeddings, index::get, pool.searchExecutor());
    this.indexing = new IndexingService(store, embeddings, index::get, clusters);
    this.listener = new ItemStoreListener() {
      @Override
      public void onItemAdded(Item item) {
        indexing.onItemAdded(item);
      }

      @Override
      public void onItemRemoved(long itemId) {
        indexing.onItemRemoved(itemId);
      }
    };
  }

  /**
   * Creates and starts an engine. A missing or unreadable snapshot is not an error: the index is
   * rebuilt from the embeddings in {@code store}.
   */
  public static DiscoveryEngine create(DiscoveryConfig config, ItemStore store, TextEncoder encoder) {
    DiscoveryEngine engine = new DiscoveryEngine(config, store, encoder);
    try {
      engine.start();
    } catch (RuntimeException e) {
      engine.pool.close();
      throw e;
    }
    return engine;
  }

  private void start() {
    index.set(loadOrBuildIndex());
    clusters.restore(store.loadClusters());
    store.addListener(listener);
    embeddings.registerMetrics();
    registerMetrics();
    LOGGER.info("Discovery engine started: {} indexed items, {} clusters", index.get().size(),
        clusters.listClusters().size());
  }

  // Search.

  public List<Item> search(String query, SearchFilters filters) {
    return searchEngine.search(query, filters);
  }

  public List<ScoredItem> searchScored(String query, SearchFilters filters) {
    return searchEngine.searchScored(query, filters);
  }

  public CompletableFuture<List<ScoredItem>> searchAsync(String query, SearchFilters filters) {
    return searchEngine.searchScoredAsync(query, filters);
  }

  // Clusters.

  public List<Cluster> listClusters() {
    return clusters.listClusters();
  }

  public Optional<Cluster> getCluster(long id) {
    return clusters.getCluster(id);
  }

  /** Starts a clustering pass, superseding one still running. */
  public CompletableFuture<ClusteringResult> recluster() {
    return pool.submitRecluster(clusters::recluster).future();
  }

  /** Starts a clustering pass only when enough items were added since the last one. */
  public CompletableFuture<Optional<ClusteringResult>> reclusterIfDue() {
    if (!clusters.shouldRecluster()) return CompletableFuture.completedFuture(Optional.empty());
    return recluster().thenApply(Optional::of);
  }

  public Cluster mergeClusters(long intoId, long fromId) {
    return clusters.mergeClusters(intoId, fromId);
  }

  public Cluster splitCluster(long clusterId, Set<Long> itemIds) {
    return clusters.splitCluster(clusterId, itemIds);
  }

  public boolean evictItem(long itemId) {
    return clusters.evictItem(itemId);
  }

  public Cluster renameCluster(long clusterId, String customLabel) {
    return clusters.renameCluster(clusterId, customLabel);
  }

  // Index maintenance.

  /** Embeds and indexes items that have no embedding yet. */
  public CompletableFuture<IndexingReport> indexPending() {
    return indexing.indexPending();
  }

  /**
   * Builds a fresh index from the stored embeddings and swaps it in; searches use the previous
   * index until the swap.
   *
   * @return the number of entries in the new index
   */
  public CompletableFuture<Integer> rebuildIndex() {
    return pool.submit(token -> {
      HnswIndex fresh = buildIndex(store.getAllItemsWithEmbeddings());
      index.set(fresh);
      // catch up with adds and removes that reached the old index during the build
      reconcile(fresh);
      clusters.invalidateGraph();
      return fresh.size();
    }).future();
  }

  /** Drops tombstones from the index; returns how many were purged. */
  public int compactIndex() {
    return index.get().compact();
  }

  /**
   * Writes the index snapshot to the configured path.
   *
   * @throws IllegalStateException when no snapshot path is configured
   */
  public void saveSnapshot() throws IOException {
    Path path = config.getSnapshotPath();
    if (path == null) throw new IllegalStateException("snapshotPath is not configured");
    IndexSnapshots.save(index.get(), path);
  }

  public HnswIndex index() {
    return index.get();
  }

  public DiscoveryConfig getConfig() {
    return config;
  }

  /** Unsubscribes from the store, saves the snapshot when configured and stops background work. */
  @Override
  public void close() {
    store.removeListener(listener);
    if (config.getSnapshotPath() != null) {
      try {
        saveSnapshot();
      } catch (IOException e) {
        LOGGER.warn("Failed to save index snapshot on close: {}", e.toString());
      }
    }
    pool.close();
  }

  // Internals.

  private HnswIndex loadOrBuildIndex() {
    Path path = config.getSnapshotPath();
    if (path != null) {
      try {
        Optional<HnswIndex> loaded = IndexSnapshots.load(config, path);
        if (loaded.isPresent()) {
          reconcile(loaded.get());
          return loaded.get();
        }
        LOGGER.info("No index snapshot at {}; building from the item store", path);
      } catch (SnapshotCorruptedException e) {
        LOGGER.warn("Index snapshot at {} is unusable ({}); rebuilding", path, e.getMessage());
      } catch (IOException e) {
        LOGGER.warn("Index snapshot at {} could not be read ({}); rebuilding", path, e.toString());
      }
    }
    return buildIndex(store.getAllItemsWithEmbeddings());
  }

  /** Makes {@code target} hold exactly the store's embedded items. */
  private void reconcile(HnswIndex target) {
    Map<Long, Item> live = new HashMap<>();
    for (Item item : store.getAllItemsWithEmbeddings()) live.put(item.id(), item);
    int removed = 0;
    int inserted = 0;
    for (long id : target.ids()) {
      if (!live.containsKey(id)) {
        target.remove(id);
        removed++;
      }
    }
    for (Item item : live.values()) {
      Optional<float[]> current = target.vector(item.id());
      if (current.isPresent() && Arrays.equals(current.get(), item.embedding())) continue;
      if (insertQuietly(target, item)) inserted++;
    }
    if (removed > 0 || inserted > 0) {
      LOGGER.info("Reconciled index with item store: {} removed, {} inserted", removed, inserted);
    }
  }

  private HnswIndex buildIndex(List<Item> items) {
    Span span = Metrics.tracer().spanBuilder("discovery.index.rebuild")
        .setSpanKind(SpanKind.INTERNAL)
        .setAttribute("items", items.size())
        .startSpan();
    long t0 = System.nanoTime();
    try {
      HnswIndex fresh = new HnswIndex(config);
      for (Item item : items) insertQuietly(fresh, item);
      LOGGER.info("Built index with {} entries", fresh.size());
      return fresh;
    } catch (RuntimeException e) {
      span.recordException(e);
      span.setStatus(StatusCode.ERROR);
      throw e;
    } finally {
      REBUILD_DURATION_MS.record((System.nanoTime() - t0) / 1_000_000.0, metricAttrs);
      span.end();
    }
  }

  private static boolean insertQuietly(HnswIndex target, Item item) {
    try {
      target.insert(item.id(), item.embedding());
      return true;
    } catch (DimensionMismatchException e) {
      LOGGER.warn("Not indexing item {}: {}", item.id(), e.getMessage());
      return false;
    }
  }

  private void registerMetrics() {
    Meter meter = Metrics.meter();
    meter.gaugeBuilder("discovery.index.size")
        .ofLongs()
        .setDescription("Live entries in the vector index")
        .setUnit("entries")
        .buildWithCallback(obs -> obs.record(index.get().size(), metricAttrs));
    meter.gaugeBuilder("discovery.index.tombstones")
        .ofLongs()
        .setDescription("Removed entries awaiting compaction")
        .setUnit("entries")
        .buildWithCallback(obs -> obs.record(index.get().tombstoneCount(), metricAttrs));
  }
}
