package io.github.panghy.discovery.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import lombok.Builder;

/**
 * Post-fusion result filters. Every bound is optional ({@code null} = unbounded) and bounds are
 * inclusive. Empty {@code sources}/{@code clusterIds} sets mean "any".
 *
 * @param minDuration     shortest accepted duration
 * @param maxDuration     longest accepted duration
 * @param publishedAfter  earliest accepted {@link Item#recency()}
 * @param publishedBefore latest accepted {@link Item#recency()}
 * @param sources         accepted sources
 * @param clusterIds      accepted cluster ids; unclustered items never match a non-empty set
 */
@Builder
public record SearchFilters(
    Duration minDuration,
    Duration maxDuration,
    Instant publishedAfter,
    Instant publishedBefore,
    Set<Source> sources,
    Set<Long> clusterIds) {

  /** Filters that accept every item. */
  public static final SearchFilters NONE = SearchFilters.builder().build();

  public SearchFilters {
    sources = sources == null ? Set.of() : Set.copyOf(sources);
    clusterIds = clusterIds == null ? Set.of() : Set.copyOf(clusterIds);
    if (minDuration != null && maxDuration != null && minDuration.compareTo(maxDuration) > 0) {
      throw new IllegalArgumentException("minDuration must not exceed maxDuration");
    }
    if (publishedAfter != null && publishedBefore != null && publishedAfter.isAfter(publishedBefore)) {
      throw new IllegalArgumentException("publishedAfter must not be later than publishedBefore");
    }
  }

  /** Whether {@code item} passes every configured bound. */
  public boolean matches(Item item) {
    if (minDuration != null && item.duration().compareTo(minDuration) < 0) return false;
    if (maxDuration != null && item.duration().compareTo(maxDuration) > 0) return false;
    Instant when = item.recency();
    if (publishedAfter != null && when.isBefore(publishedAfter)) return false;
    if (publishedBefore != null && when.isAfter(publishedBefore)) return false;
    if (!sources.isEmpty() && !sources.contains(item.source())) return false;
    if (!clusterIds.isEmpty() && (item.clusterId() == null || !clusterIds.contains(item.clusterId()))) {
      return false;
    }
    return true;
  }

  /** Whether no bound is configured. */
  public boolean isEmpty() {
    return minDuration == null
        && maxDuration == null
        && publishedAfter == null
        && publishedBefore == null
        && sources.isEmpty()
        && clusterIds.isEmpty();
  }
}
