package io.github.panghy.discovery.embed;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ibm.asyncutil.locks.AsyncSemaphore;
import com.ibm.asyncutil.locks.FairAsyncSemaphore;
import io.github.panghy.discovery.api.TextEncoder;
import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.text.TextPreparer;
import io.github.panghy.discovery.util.Metrics;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.Meter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns text into fixed-length vectors through a pluggable {@link TextEncoder}.
 *
 * <p>Text is normalized by {@link TextPreparer} before encoding. Batches run at most
 * {@code embeddingConcurrency} encoder calls at once; a failing text produces a failed
 * {@link EmbeddingResult} and never aborts the rest of the batch. Query embeddings are memoized by
 * prepared text.</p>
 */
public class EmbeddingService {
  private static final Logger LOGGER = LoggerFactory.getLogger(EmbeddingService.class);

  private final DiscoveryConfig config;
  private final TextEncoder encoder;
  private final Executor executor;
  private final TextPreparer preparer;
  private final AsyncSemaphore permits;
  private final Cache<String, float[]> queryCache;
  private final Attributes baseAttrs;

  public EmbeddingService(DiscoveryConfig config, TextEncoder encoder, Executor executor) {
    this.config = config;
    this.encoder = encoder;
    this.executor = executor;
    this.preparer = new TextPreparer(config.getMaxTextLength());
    this.permits = new FairAsyncSemaphore(config.getEmbeddingConcurrency());
    this.queryCache = Caffeine.newBuilder()
        .maximumSize(config.getEmbeddingCacheSize())
        .recordStats()
        .build();
    this.baseAttrs = Metrics.attrs(config.getMetricAttributes());
  }

  /**
   * Embeds one text.
   *
   * @throws EmbeddingException {@code EMPTY_INPUT} when nothing remains after preparation,
   *                            {@code MODEL_UNAVAILABLE} when the encoder is down,
   *                            {@code INFERENCE_FAILED} when encoding fails or returns a bad vector
   */
  public float[] embed(String text) throws EmbeddingException {
    return encodePrepared(prepare(text));
  }

  /**
   * Embeds many texts; results keep input order and each carries its own success or failure.
   */
  public CompletableFuture<List<EmbeddingResult>> embedBatch(List<String> texts) {
    List<CompletableFuture<EmbeddingResult>> futures = new ArrayList<>(texts.size());
    for (String text : texts) {
      futures.add(permits.acquire()
          .toCompletableFuture()
          .thenApplyAsync($ -> embedQuietly(text), executor)
          .whenComplete((r, ex) -> permits.release()));
    }
    return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
        .thenApply(v -> {
          List<EmbeddingResult> out = new ArrayList<>(futures.size());
          for (CompletableFuture<EmbeddingResult> f : futures) out.add(f.join());
          return out;
        });
  }

  /**
   * Embeds a search query, reusing the vector of an earlier identical (after preparation) query.
   */
  public float[] embedQuery(String query) throws EmbeddingException {
    String prepared = prepare(query);
    float[] cached = queryCache.getIfPresent(prepared);
    if (cached != null) return cached;
    float[] vector = encodePrepared(prepared);
    queryCache.put(prepared, vector);
    return vector;
  }

  public TextPreparer getPreparer() {
    return preparer;
  }

  /** Registers observable gauges for the query-embedding cache. */
  public void registerMetrics() {
    Meter meter = Metrics.meter();
    Attributes attrs = baseAttrs.toBuilder().put("cache", "query_embedding").build();
    meter.gaugeBuilder("discovery.embedding.cache.size")
        .ofLongs()
        .setDescription("Estimated cache size")
        .setUnit("entries")
        .buildWithCallback(obs -> obs.record(queryCache.estimatedSize(), attrs));
    meter.gaugeBuilder("discovery.embedding.cache.hit_count")
        .ofLongs()
        .buildWithCallback(obs -> obs.record(queryCache.stats().hitCount(), attrs));
    meter.gaugeBuilder("discovery.embedding.cache.miss_count")
        .ofLongs()
        .buildWithCallback(obs -> obs.record(queryCache.stats().missCount(), attrs));
  }

  private EmbeddingResult embedQuietly(String text) {
    try {
      return EmbeddingResult.success(embed(text));
    } catch (EmbeddingException e) {
      return EmbeddingResult.failure(e);
    }
  }

  private String prepare(String text) throws EmbeddingException {
    String prepared = preparer.prepare(text);
    if (prepared.isEmpty()) {
      throw fail(new EmbeddingException(EmbeddingException.Kind.EMPTY_INPUT, "nothing to embed after preparation"));
    }
    return prepared;
  }

  private float[] encodePrepared(String prepared) throws EmbeddingException {
    if (!encoder.isAvailable()) {
      throw fail(new EmbeddingException(EmbeddingException.Kind.MODEL_UNAVAILABLE, "text encoder is unavailable"));
    }
    float[] vector;
    try {
      vector = encoder.encode(prepared);
    } catch (RuntimeException e) {
      throw fail(new EmbeddingException(EmbeddingException.Kind.INFERENCE_FAILED, "encoder failed", e));
    }
    if (vector == null) {
      throw fail(new EmbeddingException(EmbeddingException.Kind.INFERENCE_FAILED, "encoder returned no vector"));
    }
    if (vector.length != config.getDimension()) {
      throw fail(new EmbeddingException(
          EmbeddingException.Kind.INFERENCE_FAILED,
          "encoder returned " + vector.length + " dims, expected " + config.getDimension()));
    }
    Metrics.EMBEDDING_COUNT.add(1, baseAttrs);
    return vector;
  }

  private EmbeddingException fail(EmbeddingException e) {
    Metrics.EMBEDDING_FAILURES.add(1, baseAttrs.toBuilder().put("kind", e.getKind().name()).build());
    if (e.getKind() != EmbeddingException.Kind.EMPTY_INPUT) {
      LOGGER.warn("Embedding failed ({}): {}", e.getKind(), e.getMessage());
    }
    return e;
  }
}
