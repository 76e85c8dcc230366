package io.github.panghy.discovery.index;

/**
 * An index hit.
 *
 * @param itemId     id of the matching item
 * @param similarity cosine similarity (or inner product under {@code INNER_PRODUCT}); higher is closer
 */
public record Neighbor(long itemId, double similarity) {}
