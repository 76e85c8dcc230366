package io.github.panghy.discovery.api;

/** Change notifications published by an {@link ItemStore}. */
public interface ItemStoreListener {

  /** Called after an item was added or its metadata replaced. */
  void onItemAdded(Item item);

  /** Called after an item was deleted. Its id is never reused. */
  void onItemRemoved(long itemId);
}
