package io.github.panghy.discovery.search;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.panghy.discovery.api.Item;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordMatcherTest {

  static Item item(long id, String title, Instant published) {
    return Item.builder().id(id).title(title).publishedAt(published).build();
  }

  @Test
  void scoresByDistinctTokensFound() {
    List<Item> items = List.of(
        item(1, "Sourdough bread basics", Instant.parse("2024-01-01T00:00:00Z")),
        item(2, "Banana bread", Instant.parse("2024-01-01T00:00:00Z")),
        item(3, "Mountain hiking", Instant.parse("2024-01-01T00:00:00Z")));

    List<KeywordMatcher.Hit> hits = KeywordMatcher.match(List.of("sourdough", "bread"), items);

    assertThat(hits).extracting(h -> h.item().id()).containsExactly(1L, 2L);
    assertThat(hits).extracting(KeywordMatcher.Hit::score).containsExactly(2, 1);
  }

  @Test
  void matchingIsCaseInsensitiveSubstring() {
    List<KeywordMatcher.Hit> hits = KeywordMatcher.match(
        List.of("bake"), List.of(item(1, "BAKERY Tour", null)));
    assertThat(hits).hasSize(1);
  }

  @Test
  void ties_break_by_recency_then_id() {
    List<Item> items = List.of(
        item(5, "pasta night", Instant.parse("2023-01-01T00:00:00Z")),
        item(3, "pasta party", Instant.parse("2024-01-01T00:00:00Z")),
        item(4, "pasta salad", Instant.parse("2024-01-01T00:00:00Z")));

    List<KeywordMatcher.Hit> hits = KeywordMatcher.match(List.of("pasta"), items);

    assertThat(hits).extracting(h -> h.item().id()).containsExactly(3L, 4L, 5L);
  }

  @Test
  void addedAtStandsInForMissingPublishTime() {
    Item older = Item.builder().id(1).title("guitar").addedAt(Instant.parse("2020-01-01T00:00:00Z")).build();
    Item newer = Item.builder().id(2).title("guitar").addedAt(Instant.parse("2022-01-01T00:00:00Z")).build();
    assertThat(KeywordMatcher.match(List.of("guitar"), List.of(older, newer)))
        .extracting(h -> h.item().id())
        .containsExactly(2L, 1L);
  }

  @Test
  void noTokensMatchesNothing() {
    assertThat(KeywordMatcher.match(List.of(), List.of(item(1, "anything", null)))).isEmpty();
    assertThat(KeywordMatcher.match(List.of("zzz"), List.of(item(1, "anything", null)))).isEmpty();
  }
}
