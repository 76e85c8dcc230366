package io.github.panghy.discovery.tasks;

import io.github.panghy.discovery.cluster.CancellationToken;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed pool of daemon workers for CPU-bound jobs (index rebuilds, reclustering, embedding
 * batches), plus a separate search lane so queries never queue behind those jobs.
 *
 * <p>At most one recluster is live: {@link #submitRecluster} flags the previous one cancelled
 * before queueing the new job.</p>
 */
public final class BackgroundTaskPool implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(BackgroundTaskPool.class);
  private static final long SHUTDOWN_GRACE_SECONDS = 5;

  private final ExecutorService executor;
  private final ExecutorService searchExecutor;
  private TaskHandle<?> currentRecluster;

  public BackgroundTaskPool(int threads) {
    this(threads, 1);
  }

  public BackgroundTaskPool(int threads, int searchThreads) {
    if (threads < 1) throw new IllegalArgumentException("threads must be at least 1");
    if (searchThreads < 1) throw new IllegalArgumentException("searchThreads must be at least 1");
    this.executor = Executors.newFixedThreadPool(threads, daemonThreads("discovery-worker-"));
    this.searchExecutor = Executors.newFixedThreadPool(searchThreads, daemonThreads("discovery-search-"));
    LOG.debug("BackgroundTaskPool starting threads={} searchThreads={}", threads, searchThreads);
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  /** Executor for background jobs. */
  public Executor executor() {
    return executor;
  }

  /** Executor reserved for search work; nothing submitted through this pool runs on it. */
  public Executor searchExecutor() {
    return searchExecutor;
  }

  /** Runs {@code job} on a worker; the job receives its own handle as cancellation token. */
  public <T> TaskHandle<T> submit(Function<CancellationToken, T> job) {
    TaskHandle<T> handle = new TaskHandle<>();
    try {
      executor.execute(() -> {
        try {
          handle.future().complete(job.apply(handle));
        } catch (Throwable t) {
          handle.future().completeExceptionally(t);
        }
      });
    } catch (RejectedExecutionException e) {
      handle.future().completeExceptionally(e);
    }
    return handle;
  }

  /** Cancels the in-flight recluster, if any, then submits {@code job}. */
  public synchronized <T> TaskHandle<T> submitRecluster(Function<CancellationToken, T> job) {
    if (currentRecluster != null && !currentRecluster.isDone()) {
      LOG.debug("Superseding in-flight recluster");
      currentRecluster.cancel();
    }
    TaskHandle<T> handle = submit(job);
    currentRecluster = handle;
    return handle;
  }

  /** Cancels the in-flight recluster and stops the workers, waiting briefly for running jobs. */
  @Override
  public void close() {
    synchronized (this) {
      if (currentRecluster != null) currentRecluster.cancel();
    }
    searchExecutor.shutdownNow();
    executor.shutdown();
    try {
      if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
        LOG.warn("Background jobs still running after {}s; interrupting", SHUTDOWN_GRACE_SECONDS);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
