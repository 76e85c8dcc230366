package io.github.panghy.discovery.index;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.util.Distances;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the in-memory HNSW index: nearest-neighbour quality, determinism, updates,
 * deletes with link repair, and compaction.
 */
class HnswIndexTest {

  static DiscoveryConfig config(int dimension) {
    return DiscoveryConfig.builder()
        .dimension(dimension)
        .m(8)
        .efConstruction(64)
        .efSearch(64)
        .randomSeed(42)
        .build();
  }

  static float[] randomVector(Random rnd, int dimension) {
    float[] v = new float[dimension];
    for (int i = 0; i < dimension; i++) v[i] = (float) rnd.nextGaussian();
    return v;
  }

  static HnswIndex filled(DiscoveryConfig cfg, int count, long seed) {
    HnswIndex index = new HnswIndex(cfg);
    Random rnd = new Random(seed);
    for (int i = 0; i < count; i++) index.insert(i, randomVector(rnd, cfg.getDimension()));
    return index;
  }

  @Test
  void query_returns_exact_top_on_small_set() {
    HnswIndex index = new HnswIndex(config(3));
    index.insert(1, new float[] {1f, 0f, 0f});
    index.insert(2, new float[] {0f, 1f, 0f});
    index.insert(3, new float[] {0f, 0f, 1f});
    index.insert(4, new float[] {1f, 1f, 0f});

    List<Neighbor> res = index.query(new float[] {2f, 0.1f, 0f}, 2);

    assertThat(res).extracting(Neighbor::itemId).containsExactly(1L, 4L);
    assertThat(res.get(0).similarity()).isGreaterThan(res.get(1).similarity());
    assertThat(res.get(0).similarity()).isCloseTo(Distances.cosine(new float[] {2f, 0.1f, 0f}, new float[] {1f, 0f, 0f}),
        org.assertj.core.data.Offset.offset(1e-5));
  }

  @Test
  void recall_against_brute_force() {
    DiscoveryConfig cfg = config(16);
    Random rnd = new Random(7);
    HnswIndex index = new HnswIndex(cfg);
    List<float[]> vectors = new ArrayList<>();
    for (int i = 0; i < 500; i++) {
      float[] v = randomVector(rnd, 16);
      vectors.add(v);
      index.insert(i, v);
    }
    int k = 10;
    int hits = 0;
    for (int q = 0; q < 20; q++) {
      float[] query = randomVector(rnd, 16);
      List<Long> truth = new ArrayList<>();
      for (long i = 0; i < vectors.size(); i++) truth.add(i);
      truth.sort(Comparator.comparingDouble((Long i) -> -Distances.cosine(query, vectors.get(i.intValue()))));
      Set<Long> expected = new HashSet<>(truth.subList(0, k));
      for (Neighbor n : index.query(query, k)) {
        if (expected.contains(n.itemId())) hits++;
      }
    }
    assertThat(hits / (20.0 * k)).isGreaterThanOrEqualTo(0.9);
  }

  @Test
  void same_seed_and_order_build_the_same_graph() {
    DiscoveryConfig cfg = config(8);
    HnswIndex a = filled(cfg, 200, 11);
    HnswIndex b = filled(cfg, 200, 11);

    assertThat(a.entryPoint()).isEqualTo(b.entryPoint());
    for (long id : a.ids()) {
      assertThat(a.links(id, 0)).as("layer 0 links of %d", id).isEqualTo(b.links(id, 0));
    }
    float[] queryVec = randomVector(new Random(3), 8);
    assertThat(a.query(queryVec, 10)).isEqualTo(b.query(queryVec, 10));
  }

  @Test
  void repeated_queries_are_identical() {
    HnswIndex index = filled(config(8), 150, 5);
    float[] queryVec = randomVector(new Random(99), 8);
    List<Neighbor> first = index.query(queryVec, 15);
    for (int i = 0; i < 5; i++) {
      assertThat(index.query(queryVec, 15)).isEqualTo(first);
    }
  }

  @Test
  void equal_scores_are_ordered_by_id() {
    HnswIndex index = new HnswIndex(config(2));
    index.insert(5, new float[] {1f, 0f});
    index.insert(3, new float[] {2f, 0f});
    index.insert(9, new float[] {0f, 1f});

    assertThat(index.query(new float[] {1f, 0f}, 2)).extracting(Neighbor::itemId).containsExactly(3L, 5L);
  }

  @Test
  void reinserting_an_id_replaces_its_vector() {
    HnswIndex index = new HnswIndex(config(2));
    index.insert(1, new float[] {1f, 0f});
    index.insert(2, new float[] {0f, 1f});
    index.insert(1, new float[] {0f, 2f});

    assertThat(index.size()).isEqualTo(2);
    assertThat(index.vector(1)).hasValueSatisfying(v -> assertThat(v).containsExactly(0f, 2f));
    List<Neighbor> res = index.query(new float[] {0f, 1f}, 5);
    assertThat(res).extracting(Neighbor::itemId).containsExactly(1L, 2L);
  }

  @Test
  void dimension_mismatch_leaves_index_unchanged() {
    HnswIndex index = filled(config(4), 10, 1);

    assertThatThrownBy(() -> index.insert(100, new float[3]))
        .isInstanceOf(DimensionMismatchException.class)
        .satisfies(e -> {
          DimensionMismatchException dm = (DimensionMismatchException) e;
          assertThat(dm.getExpected()).isEqualTo(4);
          assertThat(dm.getActual()).isEqualTo(3);
        });
    assertThat(index.size()).isEqualTo(10);
    assertThat(index.contains(100)).isFalse();
    assertThatThrownBy(() -> index.query(new float[5], 1)).isInstanceOf(DimensionMismatchException.class);
  }

  @Test
  void insert_then_remove_is_invisible() {
    DiscoveryConfig cfg = config(8);
    HnswIndex index = filled(cfg, 100, 21);
    float[] v = randomVector(new Random(1234), 8);

    index.insert(999, v);
    assertThat(index.query(v, 1)).extracting(Neighbor::itemId).containsExactly(999L);
    assertThat(index.remove(999)).isTrue();
    assertThat(index.remove(999)).isFalse();

    assertThat(index.contains(999)).isFalse();
    assertThat(index.query(v, 100)).extracting(Neighbor::itemId).doesNotContain(999L);

    index.insert(1000, v);
    assertThat(index.query(v, 1)).extracting(Neighbor::itemId).containsExactly(1000L);
    assertThat(index.size()).isEqualTo(101);
  }

  @Test
  void removal_repairs_inbound_links() {
    DiscoveryConfig cfg = config(8);
    Random rnd = new Random(77);
    HnswIndex index = new HnswIndex(cfg);
    List<float[]> vectors = new ArrayList<>();
    for (int i = 0; i < 200; i++) {
      float[] v = randomVector(rnd, 8);
      vectors.add(v);
      index.insert(i, v);
    }
    Set<Long> removed = new HashSet<>();
    for (long id = 0; id < 200; id += 5) {
      index.remove(id);
      removed.add(id);
    }

    for (long id : index.ids()) {
      for (int layer = 0; layer < 4; layer++) {
        assertThat(index.links(id, layer)).doesNotContainAnyElementsOf(removed);
      }
    }
    int found = 0;
    for (long id : index.ids()) {
      List<Neighbor> res = index.query(vectors.get((int) id), 1);
      if (!res.isEmpty() && res.get(0).itemId() == id) found++;
    }
    assertThat(found).isGreaterThanOrEqualTo((int) (0.98 * index.size()));
    assertThat(index.entryPoint()).isPresent();
    assertThat(removed).doesNotContain(index.entryPoint().get());
  }

  @Test
  void compact_purges_tombstones() {
    HnswIndex index = filled(config(8), 60, 3);
    for (long id = 0; id < 10; id++) index.remove(id);
    assertThat(index.tombstoneCount()).isEqualTo(10);
    float[] queryVec = randomVector(new Random(8), 8);
    List<Neighbor> before = index.query(queryVec, 5);

    assertThat(index.compact()).isEqualTo(10);

    assertThat(index.tombstoneCount()).isZero();
    assertThat(index.size()).isEqualTo(50);
    assertThat(index.query(queryVec, 5)).isEqualTo(before);
    assertThat(index.compact()).isZero();
  }

  @Test
  void removing_everything_empties_the_index() {
    HnswIndex index = filled(config(4), 12, 9);
    for (long id = 0; id < 12; id++) index.remove(id);

    assertThat(index.size()).isZero();
    assertThat(index.entryPoint()).isEmpty();
    assertThat(index.query(new float[] {1f, 0f, 0f, 0f}, 3)).isEmpty();

    index.insert(50, new float[] {1f, 0f, 0f, 0f});
    assertThat(index.query(new float[] {1f, 0f, 0f, 0f}, 3)).extracting(Neighbor::itemId).containsExactly(50L);
  }

  @Test
  void inner_product_similarity_is_the_dot_product() {
    DiscoveryConfig cfg = DiscoveryConfig.builder()
        .dimension(2)
        .metric(DiscoveryConfig.Metric.INNER_PRODUCT)
        .m(4)
        .efConstruction(16)
        .build();
    HnswIndex index = new HnswIndex(cfg);
    index.insert(1, new float[] {0.6f, 0.8f});
    index.insert(2, new float[] {1f, 0f});

    List<Neighbor> res = index.query(new float[] {1f, 0f}, 2);
    assertThat(res).extracting(Neighbor::itemId).containsExactly(2L, 1L);
    assertThat(res.get(1).similarity()).isCloseTo(0.6, org.assertj.core.data.Offset.offset(1e-6));
  }

  @Test
  void non_positive_k_returns_nothing() {
    HnswIndex index = filled(config(4), 5, 2);
    assertThat(index.query(new float[4], 0)).isEmpty();
  }
}
