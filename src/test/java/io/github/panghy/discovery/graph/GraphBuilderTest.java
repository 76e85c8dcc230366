package io.github.panghy.discovery.graph;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.panghy.discovery.api.Item;
import io.github.panghy.discovery.config.DiscoveryConfig;
import io.github.panghy.discovery.index.HnswIndex;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests that the similarity graph is derived from index neighbours and tolerates stale index
 * entries.
 */
class GraphBuilderTest {
  static final int DIM = 8;

  DiscoveryConfig cfg;
  HnswIndex index;
  GraphBuilder builder;
  List<Item> items;

  @BeforeEach
  void setup() {
    cfg = DiscoveryConfig.builder().dimension(DIM).m(8).efConstruction(32).build();
    index = new HnswIndex(cfg);
    builder = new GraphBuilder(() -> index, cfg);
    items = new ArrayList<>();
    Random rnd = new Random(17);
    // two groups around orthogonal axes
    for (int i = 0; i < 20; i++) {
      int axis = i < 10 ? 0 : 1;
      float[] v = new float[DIM];
      v[axis] = 1f;
      for (int d = 2; d < DIM; d++) v[d] = (float) (rnd.nextGaussian() * 0.05);
      Item item = Item.builder().id(i).title("item " + i).embedding(v).build();
      items.add(item);
      index.insert(i, v);
    }
  }

  @Test
  void builds_knn_edges_within_groups_only() {
    KnnGraph g = builder.buildGraph(items, 3);

    assertThat(g.nodeCount()).isEqualTo(20);
    for (long id = 0; id < 20; id++) {
      assertThat(g.neighbors(id)).isNotEmpty();
      for (long other : g.neighbors(id).keySet()) {
        assertThat(other < 10).as("edge %d-%d stays in its group", id, other).isEqualTo(id < 10);
        assertThat(g.weight(id, other)).isGreaterThan(0.0).isLessThanOrEqualTo(1.0 + 1e-6);
      }
    }
  }

  @Test
  void single_live_item_has_no_edges() {
    KnnGraph g = builder.buildGraph(items.subList(0, 1), 3);
    // a single live item: every index hit besides itself is stale
    assertThat(g.nodes()).containsExactly(0L);
    assertThat(g.edgeCount()).isZero();
  }

  @Test
  void items_without_embedding_are_skipped() {
    List<Item> withPending = new ArrayList<>(items);
    withPending.add(Item.builder().id(99).title("pending").build());

    KnnGraph g = builder.buildGraph(withPending, 3);

    assertThat(g.containsNode(99)).isFalse();
    assertThat(g.nodeCount()).isEqualTo(20);
  }

  @Test
  void stale_index_entries_are_ignored() {
    // item 5 deleted from the library but still in the index
    List<Item> live = new ArrayList<>(items);
    live.remove(5);

    KnnGraph g = builder.buildGraph(live, 3);

    assertThat(g.containsNode(5)).isFalse();
    for (long id : g.nodes()) assertThat(g.neighbors(id)).doesNotContainKey(5L);
  }

  @Test
  void add_node_links_into_existing_graph() {
    KnnGraph g = builder.buildGraph(items, 3);
    float[] v = new float[DIM];
    v[1] = 1f;
    v[2] = 0.01f;
    Item added = Item.builder().id(50).title("late").embedding(v).build();
    index.insert(50, v);

    assertThat(builder.addNode(g, added, 3, g::containsNode)).isTrue();

    assertThat(g.containsNode(50)).isTrue();
    assertThat(g.neighbors(50)).hasSize(3);
    assertThat(g.neighbors(50).keySet()).allMatch(id -> id >= 10);
    assertThat(builder.addNode(g, Item.builder().id(51).title("no vector").build(), 3, g::containsNode)).isFalse();
  }

  @Test
  void re_adding_a_moved_item_replaces_its_edges() {
    KnnGraph g = builder.buildGraph(items, 3);
    assertThat(g.neighbors(2L).keySet()).allMatch(id -> id < 10);

    // item 2 is re-embedded into the second group
    float[] moved = new float[DIM];
    moved[1] = 1f;
    moved[3] = 0.02f;
    index.insert(2, moved);
    builder.addNode(g, Item.builder().id(2).title("item 2").embedding(moved).build(), 3, g::containsNode);

    assertThat(g.neighbors(2L)).hasSize(3);
    assertThat(g.neighbors(2L).keySet()).allMatch(id -> id >= 10);
    for (long id = 0; id < 10; id++) assertThat(g.weight(id, 2L)).isZero();
  }
}
