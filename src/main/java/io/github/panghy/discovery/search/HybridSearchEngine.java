package io.github.panghy.discovery.search;

import static io.github.panghy.discovery.util.Metrics.SEARCH_COUNT;
import static io.github.panghy.discovery.util.Metrics.SEARCH_DURATION_MS;
import static io.github.panghy.discovery.util.Metrics.STALE_SKIPPED;

import io.github.panghy.discovery.api.Item;
import io.github.panghy.discovery.api.ItemStore;
import io.github.panghy.discovery.api.SearchFilters;
import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.embed.EmbeddingException;
import io.github.panghy.discovery.embed.EmbeddingService;
import io.github.panghy.discovery.index.HnswIndex;
import io.github.panghy.discovery.index.Neighbor;
import io.github.panghy.discovery.text.Tokenizer;
import io.github.panghy.discovery.util.Metrics;
import io.opentelemetry.api.common.Attributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Combines keyword matching and vector similarity into one ranked result list.
 *
 * <p>The vector path (query embedding and index lookup) runs on the supplied executor, which
 * must be reserved for searches, and is bounded by {@code searchTimeout}. The keyword path runs
 * on the calling thread meanwhile. A path that fails or times out contributes nothing; when
 * neither path produces a ranking the search fails with {@link SearchFailedException}, so a
 * failed search is never mistaken for one that matched nothing. The fused list is filtered
 * afterwards and capped at {@code maxResults}.</p>
 */
public class HybridSearchEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(HybridSearchEngine.class);

  private final DiscoveryConfig config;
  private final ItemStore store;
  private final EmbeddingService embeddings;
  private final Supplier<HnswIndex> index;
  private final Executor executor;
  private final RankFusion fusion;
  private final Attributes metricAttrs;

  public HybridSearchEngine(
      DiscoveryConfig config,
      ItemStore store,
      EmbeddingService embeddings,
      Supplier<HnswIndex> index,
      Executor executor) {
    this.config = config;
    this.store = store;
    this.embeddings = embeddings;
    this.index = index;
    this.executor = executor;
    this.fusion = new RankFusion(
        config.getFusionStrategy(), config.getRrfK(), config.getKeywordWeight(), config.getVectorWeight());
    this.metricAttrs = Metrics.attrs(config.getMetricAttributes());
  }

  /** Ranked items for {@code query}; empty for a blank query. */
  public List<Item> search(String query, SearchFilters filters) {
    List<ScoredItem> scored = searchScored(query, filters);
    List<Item> out = new ArrayList<>(scored.size());
    for (ScoredItem s : scored) out.add(s.item());
    return out;
  }

  /**
   * Ranked items with their fused scores and per-path ranks.
   *
   * @throws SearchFailedException when both the keyword and the vector path fail
   */
  public List<ScoredItem> searchScored(String query, SearchFilters filters) {
    try {
      return searchScoredAsync(query, filters).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof SearchFailedException) throw (SearchFailedException) e.getCause();
      throw e;
    }
  }

  /**
   * Starts a search. The keyword path is evaluated before this method returns; the returned
   * future completes once the vector path finishes or times out.
   */
  public CompletableFuture<List<ScoredItem>> searchScoredAsync(String query, SearchFilters filters) {
    if (query == null || query.isBlank()) return CompletableFuture.completedFuture(List.of());
    SearchFilters effective = filters == null ? SearchFilters.NONE : filters;
    long t0 = System.nanoTime();
    SEARCH_COUNT.add(1, metricAttrs);
    long timeoutMs = config.getSearchTimeout().toMillis();

    CompletableFuture<PathOutcome> vector;
    try {
      vector = CompletableFuture.supplyAsync(() -> vectorPath(query), executor)
          .thenApply(PathOutcome::ok)
          .exceptionally(PathOutcome::failed)
          .completeOnTimeout(PathOutcome.timedOut("vector", timeoutMs), timeoutMs, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException e) {
      vector = CompletableFuture.completedFuture(PathOutcome.failed(e));
    }
    PathOutcome kw;
    try {
      kw = PathOutcome.ok(keywordPath(query));
    } catch (RuntimeException e) {
      kw = PathOutcome.failed(e);
    }

    PathOutcome keyword = kw;
    return vector.thenApply(vec -> {
      try {
        if (keyword.error() != null && vec.error() != null) {
          SearchFailedException failure =
              new SearchFailedException("keyword and vector search both failed", keyword.error());
          failure.addSuppressed(vec.error());
          throw failure;
        }
        if (keyword.error() != null) LOGGER.warn("Keyword path failed; using vector results only", keyword.error());
        if (vec.timedOut()) {
          LOGGER.debug("Vector path timed out after {} ms; using keyword results only", timeoutMs);
        } else if (vec.error() != null) {
          LOGGER.warn("Vector path failed; using keyword results only: {}", vec.error().toString());
        }
        return fuseAndFilter(keyword, vec, effective);
      } finally {
        SEARCH_DURATION_MS.record((System.nanoTime() - t0) / 1_000_000.0, metricAttrs);
      }
    });
  }

  private List<ScoredItem> fuseAndFilter(PathOutcome kw, PathOutcome vec, SearchFilters filters) {
    Map<Long, Item> items = new HashMap<>(kw.items());
    items.putAll(vec.items());
    List<ScoredItem> out = new ArrayList<>();
    for (RankFusion.Fused f : fusion.fuse(kw.hits(), vec.hits())) {
      if (out.size() >= config.getMaxResults()) break;
      Item item = items.get(f.itemId());
      if (item == null || !filters.matches(item)) continue;
      out.add(new ScoredItem(item, f.score(), f.keywordRank(), f.vectorRank()));
    }
    return out;
  }

  private PathResult keywordPath(String query) {
    List<KeywordMatcher.Hit> hits = KeywordMatcher.match(Tokenizer.queryTokens(query), store.getAllItems());
    List<RankFusion.Hit> ranked = new ArrayList<>(hits.size());
    Map<Long, Item> items = new HashMap<>();
    for (KeywordMatcher.Hit h : hits) {
      ranked.add(new RankFusion.Hit(h.item().id(), h.score()));
      items.put(h.item().id(), h.item());
    }
    return new PathResult(ranked, items);
  }

  private PathResult vectorPath(String query) {
    float[] vector;
    try {
      vector = embeddings.embedQuery(query);
    } catch (EmbeddingException e) {
      throw new CompletionException(e);
    }
    List<Neighbor> neighbors = index.get().query(vector, config.getVectorTopK());
    List<RankFusion.Hit> ranked = new ArrayList<>(neighbors.size());
    Map<Long, Item> items = new HashMap<>();
    int stale = 0;
    for (Neighbor n : neighbors) {
      Optional<Item> item = store.getItem(n.itemId());
      if (item.isEmpty()) {
        stale++;
        continue;
      }
      ranked.add(new RankFusion.Hit(n.itemId(), n.similarity()));
      items.put(n.itemId(), item.get());
    }
    if (stale > 0) {
      STALE_SKIPPED.add(stale, metricAttrs);
      LOGGER.warn("Skipped {} stale index entries for query", stale);
    }
    return new PathResult(ranked, items);
  }

  private record PathResult(List<RankFusion.Hit> hits, Map<Long, Item> items) {}

  private record PathOutcome(List<RankFusion.Hit> hits, Map<Long, Item> items, Throwable error) {

    static PathOutcome ok(PathResult result) {
      return new PathOutcome(result.hits(), result.items(), null);
    }

    static PathOutcome failed(Throwable error) {
      Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
      return new PathOutcome(List.of(), Map.of(), cause);
    }

    static PathOutcome timedOut(String path, long timeoutMs) {
      return new PathOutcome(List.of(), Map.of(),
          new TimeoutException(path + " path timed out after " + timeoutMs + " ms"));
    }

    boolean timedOut() {
      return error instanceof TimeoutException;
    }
  }
}
