package io.github.panghy.discovery.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SearchFiltersTest {

  static final Item CLIP = Item.builder()
      .id(1)
      .title("clip")
      .duration(Duration.ofMinutes(5))
      .publishedAt(Instant.parse("2024-03-01T00:00:00Z"))
      .source(Source.LOCAL)
      .clusterId(7L)
      .build();

  @Test
  void noneAcceptsEverything() {
    assertThat(SearchFilters.NONE.isEmpty()).isTrue();
    assertThat(SearchFilters.NONE.matches(CLIP)).isTrue();
    assertThat(SearchFilters.NONE.matches(Item.builder().id(2).build())).isTrue();
  }

  @Test
  void durationBoundsAreInclusive() {
    assertThat(SearchFilters.builder().minDuration(Duration.ofMinutes(5)).build().matches(CLIP)).isTrue();
    assertThat(SearchFilters.builder().maxDuration(Duration.ofMinutes(5)).build().matches(CLIP)).isTrue();
    assertThat(SearchFilters.builder().minDuration(Duration.ofMinutes(6)).build().matches(CLIP)).isFalse();
    assertThat(SearchFilters.builder().maxDuration(Duration.ofMinutes(4)).build().matches(CLIP)).isFalse();
  }

  @Test
  void dateRange() {
    SearchFilters march = SearchFilters.builder()
        .publishedAfter(Instant.parse("2024-03-01T00:00:00Z"))
        .publishedBefore(Instant.parse("2024-03-31T00:00:00Z"))
        .build();
    assertThat(march.isEmpty()).isFalse();
    assertThat(march.matches(CLIP)).isTrue();
    assertThat(march.matches(CLIP.toBuilder().publishedAt(Instant.parse("2024-04-01T00:00:00Z")).build())).isFalse();
  }

  @Test
  void sourcesAndClusters() {
    assertThat(SearchFilters.builder().sources(Set.of(Source.REMOTE)).build().matches(CLIP)).isFalse();
    assertThat(SearchFilters.builder().sources(Set.of(Source.LOCAL)).build().matches(CLIP)).isTrue();
    assertThat(SearchFilters.builder().clusterIds(Set.of(7L, 8L)).build().matches(CLIP)).isTrue();
    assertThat(SearchFilters.builder().clusterIds(Set.of(8L)).build().matches(CLIP)).isFalse();
    assertThat(SearchFilters.builder().clusterIds(Set.of(7L)).build().matches(CLIP.withClusterId(null))).isFalse();
  }

  @Test
  void invertedRangesAreRejected() {
    assertThatThrownBy(() -> SearchFilters.builder()
        .minDuration(Duration.ofMinutes(2))
        .maxDuration(Duration.ofMinutes(1))
        .build())
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> SearchFilters.builder()
        .publishedAfter(Instant.parse("2024-02-01T00:00:00Z"))
        .publishedBefore(Instant.parse("2024-01-01T00:00:00Z"))
        .build())
        .isInstanceOf(IllegalArgumentException.class);
  }
}
