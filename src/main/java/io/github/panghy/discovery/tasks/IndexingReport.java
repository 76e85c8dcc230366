package io.github.panghy.discovery.tasks;

import io.github.panghy.discovery.embed.EmbeddingException;
import java.util.List;
import java.util.Map;

/**
 * Outcome of an indexing run.
 *
 * @param indexed  ids embedded and inserted, in processing order
 * @param failures ids that could not be embedded, with the failure kind
 */
public record IndexingReport(List<Long> indexed, Map<Long, EmbeddingException.Kind> failures) {

  public IndexingReport {
    indexed = List.copyOf(indexed);
    failures = Map.copyOf(failures);
  }

  public static IndexingReport empty() {
    return new IndexingReport(List.of(), Map.of());
  }
}
