package io.github.panghy.discovery.tasks;

import io.github.panghy.discovery.cluster.CancellationToken;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A submitted background job: its result future plus the cooperative cancellation flag the job
 * polls.
 */
public final class TaskHandle<T> implements CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final CompletableFuture<T> future = new CompletableFuture<>();

  /** Asks the job to stop at its next check; does not interrupt it. */
  public void cancel() {
    cancelled.set(true);
  }

  @Override
  public boolean isCancelled() {
    return cancelled.get();
  }

  public CompletableFuture<T> future() {
    return future;
  }

  public boolean isDone() {
    return future.isDone();
  }
}
