package io.github.panghy.discovery.tasks;

import io.github.panghy.discovery.api.Item;
import io.github.panghy.discovery.api.ItemStore;
import io.github.panghy.discovery.cluster.ClusterEngine;
import io.github.panghy.discovery.embed.EmbeddingException;
import io.github.panghy.discovery.embed.EmbeddingResult;
import io.github.panghy.discovery.embed.EmbeddingService;
import io.github.panghy.discovery.index.DimensionMismatchException;
import io.github.panghy.discovery.index.HnswIndex;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the vector index and the similarity graph in step with the item store.
 */
public class IndexingService {
  private static final Logger LOGGER = LoggerFactory.getLogger(IndexingService.class);

  private final ItemStore store;
  private final EmbeddingService embeddings;
  private final Supplier<HnswIndex> index;
  private final ClusterEngine clusters;

  public IndexingService(
      ItemStore store, EmbeddingService embeddings, Supplier<HnswIndex> index, ClusterEngine clusters) {
    this.store = store;
    this.embeddings = embeddings;
    this.index = index;
    this.clusters = clusters;
  }

  /**
   * Embeds every item that has no embedding yet, persists the vectors and indexes them. Items whose
   * text cannot be embedded are reported and left pending; items removed from the store meanwhile
   * are neither indexed nor reported.
   */
  public CompletableFuture<IndexingReport> indexPending() {
    List<Item> pending = new ArrayList<>();
    for (Item item : store.getAllItems()) {
      if (!item.hasEmbedding()) pending.add(item);
    }
    if (pending.isEmpty()) return CompletableFuture.completedFuture(IndexingReport.empty());
    List<String> texts = new ArrayList<>(pending.size());
    for (Item item : pending) texts.add(item.textContent());
    LOGGER.debug("Embedding {} pending items", pending.size());
    return embeddings.embedBatch(texts).thenApply(results -> {
      List<Long> indexed = new ArrayList<>();
      Map<Long, EmbeddingException.Kind> failures = new LinkedHashMap<>();
      for (int i = 0; i < pending.size(); i++) {
        Item item = pending.get(i);
        EmbeddingResult result = results.get(i);
        if (!result.isSuccess()) {
          failures.put(item.id(), result.error().getKind());
          continue;
        }
        store.updateEmbedding(item.id(), result.vector());
        if (store.getItem(item.id()).isEmpty()) {
          LOGGER.debug("Item {} was removed while embedding; not indexing", item.id());
          continue;
        }
        if (!index(item.withEmbedding(result.vector()))) continue;
        if (store.getItem(item.id()).isEmpty()) {
          // removed between the check and the insert
          onItemRemoved(item.id());
          continue;
        }
        indexed.add(item.id());
      }
      if (!failures.isEmpty()) {
        LOGGER.warn("Indexed {} items; {} could not be embedded", indexed.size(), failures.size());
      } else {
        LOGGER.info("Indexed {} items", indexed.size());
      }
      return new IndexingReport(indexed, failures);
    });
  }

  /** Indexes an added item that already carries an embedding; others wait for {@link #indexPending}. */
  public void onItemAdded(Item item) {
    if (!item.hasEmbedding()) {
      LOGGER.debug("Item {} has no embedding yet; pending", item.id());
      return;
    }
    index(item);
  }

  public void onItemRemoved(long itemId) {
    index.get().remove(itemId);
    clusters.onItemRemoved(itemId);
  }

  private boolean index(Item item) {
    try {
      index.get().insert(item.id(), item.embedding());
    } catch (DimensionMismatchException e) {
      LOGGER.warn("Not indexing item {}: {}", item.id(), e.getMessage());
      return false;
    }
    clusters.onItemAdded(item);
    return true;
  }
}
