package io.github.panghy.discovery.index;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import org.junit.jupiter.api.Test;

class SearchCandidateTest {

  @Test
  void orders_by_distance_then_item_id() {
    List<SearchCandidate> list = new ArrayList<>(List.of(
        new SearchCandidate(0, 9, 0.5f), new SearchCandidate(1, 2, 0.5f), new SearchCandidate(2, 5, 0.1f)));
    list.sort(SearchCandidate.NEAREST_FIRST);
    assertThat(list).extracting(SearchCandidate::getItemId).containsExactly(5L, 2L, 9L);
  }

  @Test
  void farthest_first_heap_evicts_the_worst() {
    PriorityQueue<SearchCandidate> heap = new PriorityQueue<>(SearchCandidate.FARTHEST_FIRST);
    heap.add(new SearchCandidate(0, 1, 0.2f));
    heap.add(new SearchCandidate(1, 2, 0.9f));
    heap.add(new SearchCandidate(2, 3, 0.4f));
    assertThat(heap.poll().getItemId()).isEqualTo(2L);
  }

  @Test
  void lombok_value_semantics() {
    SearchCandidate a = new SearchCandidate(1, 10, 0.25f);
    SearchCandidate b = new SearchCandidate(1, 10, 0.25f);
    assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    assertThat(a.toString()).contains("itemId=10");
  }
}
