package io.github.panghy.discovery.api;

import io.github.panghy.discovery.util.Distances;
import java.time.Instant;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import lombok.Builder;

/**
 * A detected topic group.
 *
 * <p>Members are held as item ids (back references), never as items. {@code itemCount} is kept
 * equal to {@code memberIds.size()} by the compact constructor so the persisted count cannot
 * drift from the membership it describes.</p>
 *
 * @param id              identifier, carried across reclustering passes when centroids match
 * @param label           generated label
 * @param customLabel     user override, {@code null} when none; never discarded by reclustering
 * @param centroid        element-wise mean of the member embeddings
 * @param memberIds       ids of the member items
 * @param itemCount       number of members
 * @param confidenceScore advisory cohesion in [0, 1] (mean member-to-centroid cosine)
 * @param updatedAt       last time membership or label changed
 */
@Builder(toBuilder = true)
public record Cluster(
    long id,
    String label,
    String customLabel,
    float[] centroid,
    SortedSet<Long> memberIds,
    int itemCount,
    double confidenceScore,
    Instant updatedAt) {

  public Cluster {
    memberIds = memberIds == null
        ? Collections.emptySortedSet()
        : Collections.unmodifiableSortedSet(new TreeSet<>(memberIds));
    itemCount = memberIds.size();
    updatedAt = updatedAt == null ? Instant.EPOCH : updatedAt;
  }

  /** The user's label when set, otherwise the generated one. */
  public String displayLabel() {
    return customLabel != null ? customLabel : label;
  }

  /** Cosine similarity between this cluster's centroid and an embedding (0 on length mismatch). */
  public double similarity(float[] embedding) {
    if (centroid == null || embedding == null || centroid.length != embedding.length) return 0.0;
    return Distances.cosine(centroid, embedding);
  }

  @Override
  public String toString() {
    return String.format(
        "Cluster(id=%d, label=%s, itemCount=%d, confidence=%.3f)", id, displayLabel(), itemCount, confidenceScore);
  }
}
