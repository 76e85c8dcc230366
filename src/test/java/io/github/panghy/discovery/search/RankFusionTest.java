package io.github.panghy.discovery.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

import java.util.List;
import org.junit.jupiter.api.Test;

class RankFusionTest {

  static RankFusion.Hit hit(long id, double score) {
    return new RankFusion.Hit(id, score);
  }

  @Test
  void reciprocalRankRewardsItemsInBothLists() {
    RankFusion fusion = new RankFusion(FusionStrategy.RECIPROCAL_RANK, 60, 0.5, 0.5);
    // keyword: A, B; vector: B, C
    List<RankFusion.Fused> fused = fusion.fuse(List.of(hit(1, 2), hit(2, 1)), List.of(hit(2, 0.9), hit(3, 0.8)));

    assertThat(fused).extracting(RankFusion.Fused::itemId).containsExactly(2L, 1L, 3L);
    assertThat(fused.get(0).score()).isCloseTo(1.0 / 62 + 1.0 / 61, offset(1e-12));
    assertThat(fused.get(1).score()).isCloseTo(1.0 / 61, offset(1e-12));
    assertThat(fused.get(2).score()).isCloseTo(1.0 / 62, offset(1e-12));
    assertThat(fused.get(0).keywordRank()).isEqualTo(2);
    assertThat(fused.get(0).vectorRank()).isEqualTo(1);
    assertThat(fused.get(1).vectorRank()).isNull();
    assertThat(fused.get(2).keywordRank()).isNull();
  }

  @Test
  void reciprocalRankIgnoresRawScores() {
    RankFusion fusion = new RankFusion(FusionStrategy.RECIPROCAL_RANK, 60, 0.5, 0.5);
    List<RankFusion.Fused> a = fusion.fuse(List.of(hit(1, 100), hit(2, 1)), List.of());
    List<RankFusion.Fused> b = fusion.fuse(List.of(hit(1, 2), hit(2, 1.99)), List.of());
    assertThat(a).isEqualTo(b);
  }

  @Test
  void equalScoresAreOrderedById() {
    RankFusion fusion = new RankFusion(FusionStrategy.RECIPROCAL_RANK, 60, 0.5, 0.5);
    // 7 is first in keyword, 4 is first in vector: identical fused scores
    List<RankFusion.Fused> fused = fusion.fuse(List.of(hit(7, 1)), List.of(hit(4, 0.5)));
    assertThat(fused).extracting(RankFusion.Fused::itemId).containsExactly(4L, 7L);
  }

  @Test
  void smallerKWidensTheGapBetweenRanks() {
    List<RankFusion.Hit> keyword = List.of(hit(1, 3), hit(2, 2));
    double wide = gap(new RankFusion(FusionStrategy.RECIPROCAL_RANK, 1, 0.5, 0.5).fuse(keyword, List.of()));
    double narrow = gap(new RankFusion(FusionStrategy.RECIPROCAL_RANK, 60, 0.5, 0.5).fuse(keyword, List.of()));
    assertThat(wide).isGreaterThan(narrow);
  }

  static double gap(List<RankFusion.Fused> fused) {
    return fused.get(0).score() - fused.get(1).score();
  }

  @Test
  void weightedSumNormalizesKeywordScores() {
    RankFusion fusion = new RankFusion(FusionStrategy.WEIGHTED_SUM, 60, 0.3, 0.7);
    List<RankFusion.Fused> fused = fusion.fuse(
        List.of(hit(1, 4), hit(2, 2)),
        List.of(hit(2, 0.9), hit(3, -0.2)));

    assertThat(fused).extracting(RankFusion.Fused::itemId).containsExactly(2L, 1L, 3L);
    assertThat(fused.get(0).score()).isCloseTo(0.3 * 0.5 + 0.7 * 0.9, offset(1e-9));
    assertThat(fused.get(1).score()).isCloseTo(0.3, offset(1e-9));
    // negative similarity contributes nothing
    assertThat(fused.get(2).score()).isZero();
  }

  @Test
  void emptyInputs() {
    RankFusion fusion = new RankFusion(FusionStrategy.RECIPROCAL_RANK, 60, 0.5, 0.5);
    assertThat(fusion.fuse(List.of(), List.of())).isEmpty();
    assertThat(fusion.fuse(List.of(), List.of(hit(5, 0.1)))).extracting(RankFusion.Fused::itemId).containsExactly(5L);
  }

  @Test
  void repeatedIdKeepsFirstRank() {
    RankFusion fusion = new RankFusion(FusionStrategy.RECIPROCAL_RANK, 60, 0.5, 0.5);
    List<RankFusion.Fused> fused = fusion.fuse(List.of(hit(1, 2), hit(2, 1), hit(1, 1)), List.of());
    assertThat(fused.get(0).itemId()).isEqualTo(1L);
    assertThat(fused.get(0).keywordRank()).isEqualTo(1);
  }
}
