package io.github.panghy.discovery.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.panghy.discovery.api.TextEncoder;
import io.github.panghy.discovery.config.DiscoveryConfig;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmbeddingServiceTest {
  static final int DIM = 4;

  DiscoveryConfig cfg;
  ExecutorService executor;
  TextEncoder encoder;
  EmbeddingService service;

  @BeforeEach
  void setup() {
    cfg = DiscoveryConfig.builder().dimension(DIM).m(4).efConstruction(8).embeddingConcurrency(2).build();
    executor = Executors.newFixedThreadPool(4);
    encoder = mock(TextEncoder.class);
    when(encoder.isAvailable()).thenReturn(true);
    when(encoder.encode(anyString())).thenAnswer(inv -> vectorFor(inv.getArgument(0)));
    service = new EmbeddingService(cfg, encoder, executor);
  }

  @AfterEach
  void teardown() {
    executor.shutdownNow();
  }

  static float[] vectorFor(String text) {
    return new float[] {text.length(), 1f, 0f, 0f};
  }

  @Test
  void embedsPreparedText() throws Exception {
    float[] v = service.embed("  Hello   World  ");
    verify(encoder).encode("hello world");
    assertThat(v).containsExactly(11f, 1f, 0f, 0f);
  }

  @Test
  void emptyInputAfterPreparation() {
    assertThatThrownBy(() -> service.embed("   "))
        .isInstanceOfSatisfying(EmbeddingException.class,
            e -> assertThat(e.getKind()).isEqualTo(EmbeddingException.Kind.EMPTY_INPUT));
    verify(encoder, never()).encode(anyString());
  }

  @Test
  void unavailableEncoder() {
    when(encoder.isAvailable()).thenReturn(false);
    assertThatThrownBy(() -> service.embed("hello"))
        .isInstanceOfSatisfying(EmbeddingException.class,
            e -> assertThat(e.getKind()).isEqualTo(EmbeddingException.Kind.MODEL_UNAVAILABLE));
  }

  @Test
  void wrongDimensionIsAnInferenceFailure() {
    when(encoder.encode(anyString())).thenReturn(new float[] {1f, 2f});
    assertThatThrownBy(() -> service.embed("hello"))
        .isInstanceOfSatisfying(EmbeddingException.class,
            e -> assertThat(e.getKind()).isEqualTo(EmbeddingException.Kind.INFERENCE_FAILED))
        .hasMessageContaining("expected 4");
  }

  @Test
  void encoderExceptionIsAnInferenceFailure() {
    when(encoder.encode(anyString())).thenThrow(new IllegalStateException("boom"));
    assertThatThrownBy(() -> service.embed("hello"))
        .isInstanceOfSatisfying(EmbeddingException.class,
            e -> assertThat(e.getKind()).isEqualTo(EmbeddingException.Kind.INFERENCE_FAILED))
        .hasRootCauseMessage("boom");
  }

  @Test
  void batchKeepsOrderAndIsolatesFailures() {
    when(encoder.encode("bad")).thenThrow(new IllegalStateException("boom"));

    List<EmbeddingResult> results = service.embedBatch(List.of("one", "bad", "", "three")).join();

    assertThat(results).hasSize(4);
    assertThat(results.get(0).vector()).containsExactly(3f, 1f, 0f, 0f);
    assertThat(results.get(1).error().getKind()).isEqualTo(EmbeddingException.Kind.INFERENCE_FAILED);
    assertThat(results.get(2).error().getKind()).isEqualTo(EmbeddingException.Kind.EMPTY_INPUT);
    assertThat(results.get(3).isSuccess()).isTrue();
    assertThat(results.get(3).vector()).containsExactly(5f, 1f, 0f, 0f);
  }

  @Test
  void batch_never_exceeds_the_concurrency_limit() {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    TextEncoder slow = text -> {
      peak.accumulateAndGet(running.incrementAndGet(), Math::max);
      try {
        Thread.sleep(20);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        running.decrementAndGet();
      }
      return vectorFor(text);
    };
    EmbeddingService limited = new EmbeddingService(cfg, slow, executor);
    List<String> texts = new ArrayList<>();
    for (int i = 0; i < 12; i++) texts.add("text " + i);

    List<EmbeddingResult> results = limited.embedBatch(texts).join();

    assertThat(results).allMatch(EmbeddingResult::isSuccess);
    assertThat(peak.get()).isLessThanOrEqualTo(2);
  }

  @Test
  void emptyBatch() {
    assertThat(service.embedBatch(List.of()).join()).isEmpty();
  }

  @Test
  void queriesAreCachedByPreparedText() throws Exception {
    float[] first = service.embedQuery("Sourdough Bread");
    float[] second = service.embedQuery("  sourdough   bread ");

    assertThat(second).isSameAs(first);
    verify(encoder, times(1)).encode("sourdough bread");
  }

  @Test
  void failedQueriesAreNotCached() throws Exception {
    when(encoder.encode(anyString())).thenThrow(new IllegalStateException("boom")).thenReturn(new float[DIM]);
    assertThatThrownBy(() -> service.embedQuery("pasta")).isInstanceOf(EmbeddingException.class);
    assertThat(service.embedQuery("pasta")).hasSize(DIM);
    verify(encoder, times(2)).encode("pasta");
  }

  @Test
  void cacheGaugesAreExported() throws Exception {
    InMemoryMetricReader reader = InMemoryMetricReader.create();
    SdkMeterProvider meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
    OpenTelemetrySdk sdk = OpenTelemetrySdk.builder().setMeterProvider(meterProvider).build();
    GlobalOpenTelemetry.resetForTest();
    GlobalOpenTelemetry.set(sdk);
    try {
      EmbeddingService metered = new EmbeddingService(cfg, encoder, executor);
      metered.registerMetrics();
      metered.embedQuery("alpha");
      metered.embedQuery("alpha");
      metered.embedQuery("beta");

      Map<String, Long> gauges = new HashMap<>();
      for (MetricData md : reader.collectAllMetrics()) {
        if (!md.getName().startsWith("discovery.embedding.cache.")) continue;
        for (LongPointData p : md.getLongGaugeData().getPoints()) gauges.put(md.getName(), p.getValue());
      }
      assertThat(gauges)
          .containsEntry("discovery.embedding.cache.hit_count", 1L)
          .containsEntry("discovery.embedding.cache.miss_count", 2L)
          .containsKey("discovery.embedding.cache.size");
    } finally {
      GlobalOpenTelemetry.resetForTest();
      meterProvider.close();
    }
  }
}
