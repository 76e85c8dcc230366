package io.github.panghy.discovery.search;

import io.github.panghy.discovery.api.Item;

/**
 * A fused search result.
 *
 * @param item         the matching item
 * @param fusedScore   score after fusion; higher ranks first
 * @param keywordRank  1-based rank in the keyword list, {@code null} when absent from it
 * @param vectorRank   1-based rank in the vector list, {@code null} when absent from it
 */
public record ScoredItem(Item item, double fusedScore, Integer keywordRank, Integer vectorRank) {

  public long id() {
    return item.id();
  }
}
