package io.github.panghy.discovery.index;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class NeighborSelectorTest {

  private static List<SearchCandidate> candidates(float... distances) {
    List<SearchCandidate> out = new ArrayList<>();
    for (int i = 0; i < distances.length; i++) out.add(new SearchCandidate(i, 100 + i, distances[i]));
    return out;
  }

  @Test
  void testSelectEmptyList() {
    assertThat(NeighborSelector.select(List.of(), 4, (a, b) -> 1f)).isEmpty();
  }

  @Test
  void testSelectWithinDegreeLimitKeepsAll() {
    List<SearchCandidate> result = NeighborSelector.select(candidates(1f, 2f, 3f), 5, (a, b) -> 0f);
    assertThat(result).extracting(SearchCandidate::getItemId).containsExactly(100L, 101L, 102L);
  }

  @Test
  void testSelectSkipsDominatedCandidates() {
    // slots 0 and 1 are close to each other; 2 and 3 are far from everything
    NeighborSelector.PairwiseDistance pairwise = (a, b) -> {
      if ((a == 0 && b == 1) || (a == 1 && b == 0)) return 0.5f;
      return 10f;
    };
    List<SearchCandidate> result = NeighborSelector.select(candidates(1f, 2f, 3f, 4f, 5f), 3, pairwise);

    // 1 is dominated by 0 (0.5 < 2.0); 4 is never reached once three are selected
    assertThat(result).extracting(SearchCandidate::getSlot).containsExactly(0, 2, 3);
  }

  @Test
  void testSelectBackFillsWithDominated() {
    // everything is close to slot 0, so only slot 0 survives the diversity check
    NeighborSelector.PairwiseDistance pairwise = (a, b) -> 0.1f;
    List<SearchCandidate> result = NeighborSelector.select(candidates(1f, 2f, 3f, 4f), 3, pairwise);

    assertThat(result).extracting(SearchCandidate::getSlot).containsExactly(0, 1, 2);
  }

  @Test
  void testLowerAlphaPrunesLess() {
    // slot 1 sits 1.5 from slot 0, slot 2 sits 5.0 from slot 0
    NeighborSelector.PairwiseDistance pairwise = (a, b) -> (a == 2 || b == 2) ? 5f : 1.5f;
    List<SearchCandidate> strict = NeighborSelector.select(candidates(1f, 2f, 3f), 2, 1.0, pairwise);
    List<SearchCandidate> lenient = NeighborSelector.select(candidates(1f, 2f, 3f), 2, 0.5, pairwise);

    // alpha 1: slot 1 is dominated (1.5 < 2.0)
    assertThat(strict).extracting(SearchCandidate::getSlot).containsExactly(0, 2);
    // alpha 0.5: slot 1 survives (1.5 >= 1.0)
    assertThat(lenient).extracting(SearchCandidate::getSlot).containsExactly(0, 1);
  }
}
