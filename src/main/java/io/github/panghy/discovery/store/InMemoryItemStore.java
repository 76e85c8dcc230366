package io.github.panghy.discovery.store;

import io.github.panghy.discovery.api.Cluster;
import io.github.panghy.discovery.api.Item;
import io.github.panghy.discovery.api.ItemStore;
import io.github.panghy.discovery.api.ItemStoreListener;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe {@link ItemStore} held entirely in memory. Listing methods return items ascending by
 * id.
 */
public class InMemoryItemStore implements ItemStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryItemStore.class);

  private final ConcurrentMap<Long, Item> items = new ConcurrentHashMap<>();
  private final List<ItemStoreListener> listeners = new CopyOnWriteArrayList<>();
  private volatile List<Cluster> clusters = List.of();

  /** Adds or replaces an item and notifies listeners. */
  public void addItem(Item item) {
    items.put(item.id(), item);
    for (ItemStoreListener l : listeners) l.onItemAdded(item);
  }

  /**
   * Removes an item and notifies listeners.
   *
   * @return whether the item existed
   */
  public boolean removeItem(long id) {
    if (items.remove(id) == null) return false;
    for (ItemStoreListener l : listeners) l.onItemRemoved(id);
    return true;
  }

  public int size() {
    return items.size();
  }

  @Override
  public List<Item> getAllItems() {
    List<Item> out = new ArrayList<>(items.values());
    out.sort(Comparator.comparingLong(Item::id));
    return out;
  }

  @Override
  public List<Item> getAllItemsWithEmbeddings() {
    List<Item> out = new ArrayList<>();
    for (Item item : getAllItems()) {
      if (item.hasEmbedding()) out.add(item);
    }
    return out;
  }

  @Override
  public Optional<Item> getItem(long id) {
    return Optional.ofNullable(items.get(id));
  }

  @Override
  public void updateEmbedding(long id, float[] vector) {
    if (items.computeIfPresent(id, (k, item) -> item.withEmbedding(vector)) == null) {
      LOGGER.debug("Ignoring embedding for unknown item {}", id);
    }
  }

  @Override
  public void updateClusterAssignment(long id, Long clusterId) {
    items.computeIfPresent(id, (k, item) -> item.withClusterId(clusterId));
  }

  @Override
  public List<Cluster> loadClusters() {
    return clusters;
  }

  @Override
  public void replaceClusters(List<Cluster> replacement) {
    clusters = List.copyOf(replacement);
  }

  @Override
  public void addListener(ItemStoreListener listener) {
    listeners.add(listener);
  }

  @Override
  public void removeListener(ItemStoreListener listener) {
    listeners.remove(listener);
  }
}
