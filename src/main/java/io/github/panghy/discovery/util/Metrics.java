package io.github.panghy.discovery.util;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Tracer;
import java.util.Map;

/**
 * Centralizes OpenTelemetry instruments and helpers.
 */
public final class Metrics {
  public static final String INSTRUMENTATION_NAME = "io.github.panghy.discovery";
  private static final Meter METER = GlobalOpenTelemetry.getMeter(INSTRUMENTATION_NAME);
  private static final Tracer TRACER = GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME);

  // Histograms (ms)
  public static final DoubleHistogram SEARCH_DURATION_MS = METER.histogramBuilder("discovery.search.duration_ms")
      .setUnit("ms")
      .build();
  public static final DoubleHistogram INDEX_QUERY_DURATION_MS = METER.histogramBuilder(
          "discovery.index.query.duration_ms")
      .setUnit("ms")
      .build();
  public static final DoubleHistogram REBUILD_DURATION_MS = METER.histogramBuilder(
          "discovery.index.rebuild.duration_ms")
      .setUnit("ms")
      .build();
  public static final DoubleHistogram RECLUSTER_DURATION_MS = METER.histogramBuilder(
          "discovery.recluster.duration_ms")
      .setUnit("ms")
      .build();

  // Counters
  public static final LongCounter SEARCH_COUNT =
      METER.counterBuilder("discovery.search.count").build();
  public static final LongCounter EMBEDDING_COUNT =
      METER.counterBuilder("discovery.embedding.count").build();
  public static final LongCounter EMBEDDING_FAILURES =
      METER.counterBuilder("discovery.embedding.failures").build();
  public static final LongCounter RECLUSTER_RUN_COUNT =
      METER.counterBuilder("discovery.recluster.run").build();
  public static final LongCounter RECLUSTER_CANCELLED =
      METER.counterBuilder("discovery.recluster.cancelled").build();
  public static final LongCounter STALE_SKIPPED =
      METER.counterBuilder("discovery.index.stale_skipped").build();

  private Metrics() {}

  public static Tracer tracer() {
    return TRACER;
  }

  /** Meter looked up at call time, for instruments registered per instance (gauges). */
  public static Meter meter() {
    return GlobalOpenTelemetry.getMeter(INSTRUMENTATION_NAME);
  }

  public static Attributes attrs(String key, String value) {
    return Attributes.of(AttributeKey.stringKey(key), value);
  }

  public static Attributes attrs(Map<String, String> base, String key, String value) {
    AttributesBuilder b = Attributes.builder();
    for (var e : base.entrySet()) b.put(e.getKey(), e.getValue());
    return b.put(key, value).build();
  }

  public static Attributes attrs(Map<String, String> base) {
    AttributesBuilder b = Attributes.builder();
    for (var e : base.entrySet()) b.put(e.getKey(), e.getValue());
    return b.build();
  }
}
