package com.flamingo.ai.sessions.service.search.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.sessions.service.search.strategy.Tokenizer.Token;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Tokenizer Tests")
class TokenizerTest {

  @Test
  @DisplayName("should split on every non-alphanumeric character and lower-case")
  void shouldSplitAndLowerCase() {
    List<Token> tokens = Tokenizer.tokenize("Hello, World! v2_release", false);

    assertThat(tokens)
        .extracting(Token::value)
        .containsExactly("hello", "world", "v2", "release");
    assertThat(tokens.get(1).start()).isEqualTo(7);
    assertThat(tokens.get(1).end()).isEqualTo(12);
  }

  @Test
  @DisplayName("should keep case when case sensitive")
  void shouldKeepCase() {
    assertThat(Tokenizer.tokenize("Login FAILED", true))
        .extracting(Token::value)
        .containsExactly("Login", "FAILED");
  }

  @Test
  @DisplayName("should treat letters outside ASCII as word characters")
  void shouldHandleUnicodeLetters() {
    assertThat(Tokenizer.tokenize("café über-naïve", false))
        .extracting(Token::value)
        .containsExactly("café", "über", "naïve");
  }

  @Test
  @DisplayName("should return no tokens for punctuation only")
  void shouldReturnNoTokensForPunctuation() {
    assertThat(Tokenizer.tokenize("--- ... !!!", false)).isEmpty();
    assertThat(Tokenizer.tokenize(null, false)).isEmpty();
  }

  @Test
  @DisplayName("should recognize stop words regardless of case")
  void shouldRecognizeStopWords() {
    assertThat(Tokenizer.isStopWord("The")).isTrue();
    assertThat(Tokenizer.isStopWord("parser")).isFalse();
  }
}
