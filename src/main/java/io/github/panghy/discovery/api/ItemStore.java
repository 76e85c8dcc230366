package io.github.panghy.discovery.api;

import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary. The engine reads items and writes back embeddings, cluster assignments
 * and the small cluster table; the storage engine behind it is the application's concern.
 */
public interface ItemStore {

  /** Returns every item, with or without an embedding. */
  List<Item> getAllItems();

  /** Returns every item whose embedding has been computed. */
  List<Item> getAllItemsWithEmbeddings();

  /** Looks up a single item. */
  Optional<Item> getItem(long id);

  /** Persists a freshly computed embedding. Unknown ids are ignored. */
  void updateEmbedding(long id, float[] vector);

  /** Persists a cluster assignment; {@code null} clears it. Unknown ids are ignored. */
  void updateClusterAssignment(long id, Long clusterId);

  /** Returns the persisted cluster table. */
  List<Cluster> loadClusters();

  /** Replaces the persisted cluster table. */
  void replaceClusters(List<Cluster> clusters);

  /** Subscribes to item add/remove notifications. */
  void addListener(ItemStoreListener listener);

  /** Unsubscribes a listener; no-op when it was not registered. */
  void removeListener(ItemStoreListener listener);
}
