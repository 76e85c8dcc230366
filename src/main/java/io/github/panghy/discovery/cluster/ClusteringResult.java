package io.github.panghy.discovery.cluster;

import io.github.panghy.discovery.api.Cluster;
import java.util.List;

/**
 * Outcome of a reclustering pass.
 *
 * @param status      whether the pass committed or was superseded (nothing committed)
 * @param clusters    committed clusters, ascending by id
 * @param unclustered items with embeddings left without a cluster
 * @param retained    clusters that kept their id from the previous pass
 * @param modularity  modularity of the detected partition
 */
public record ClusteringResult(
    Status status, List<Cluster> clusters, int unclustered, int retained, double modularity) {

  public enum Status {
    COMPLETED,
    CANCELLED
  }

  public ClusteringResult {
    clusters = clusters == null ? List.of() : List.copyOf(clusters);
  }

  public static ClusteringResult cancelled() {
    return new ClusteringResult(Status.CANCELLED, List.of(), 0, 0, 0.0);
  }

  public boolean isCancelled() {
    return status == Status.CANCELLED;
  }
}
