package io.github.panghy.discovery.text;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TokenizerTest {

  @Test
  void queryTokensDropStopwordsAndDuplicates() {
    assertThat(Tokenizer.queryTokens("How to bake THE bread, bread!"))
        .containsExactly("bake", "bread");
  }

  @Test
  void blankQueryHasNoTokens() {
    assertThat(Tokenizer.queryTokens("")).isEmpty();
    assertThat(Tokenizer.queryTokens("   ")).isEmpty();
    assertThat(Tokenizer.queryTokens(null)).isEmpty();
  }

  @Test
  void termsKeepDuplicatesAndSkipNumbersAndShortWords() {
    assertThat(Tokenizer.terms("Bread 2024 is ok, bread rules", 3))
        .containsExactly("bread", "bread", "rules");
  }
}
