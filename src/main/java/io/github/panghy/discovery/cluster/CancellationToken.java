package io.github.panghy.discovery.cluster;

/**
 * Cooperative cancellation flag polled by long-running passes.
 */
@FunctionalInterface
public interface CancellationToken {
  /** A token that is never cancelled. */
  CancellationToken NONE = () -> false;

  boolean isCancelled();
}
