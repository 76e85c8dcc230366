package io.github.panghy.discovery.search;

/**
 * How keyword and vector rankings are combined into one list.
 */
public enum FusionStrategy {
  /** {@code score(d) = Σ 1/(k + rank(d))} over the lists containing {@code d}. */
  RECIPROCAL_RANK,
  /** Weighted sum of the normalized keyword score and the vector similarity. */
  WEIGHTED_SUM
}
