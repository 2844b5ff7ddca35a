package com.flamingo.ai.sessions.service.search;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SnippetExtractor Tests")
class SnippetExtractorTest {

  private final SnippetExtractor extractor = new SnippetExtractor();

  @Test
  @DisplayName("should expand the match by the context size on both sides")
  void shouldExpandByContext() {
    String text = "0123456789MATCH0123456789";

    assertThat(extractor.extract(text, 10, 15, 3)).isEqualTo("789MATCH012");
  }

  @Test
  @DisplayName("should clip the window to the message text")
  void shouldClipToMessage() {
    String text = "short MATCH text";

    assertThat(extractor.extract(text, 6, 11, 150)).isEqualTo(text);
  }

  @Test
  @DisplayName("should return only the match for a zero context size")
  void shouldReturnMatchOnly() {
    assertThat(extractor.extract("abc MATCH def", 4, 9, 0)).isEqualTo("MATCH");
  }

  @Test
  @DisplayName("should not split surrogate pairs at the window edges")
  void shouldNotSplitSurrogatePairs() {
    String text = "\uD83D\uDE00xMATCHx\uD83D\uDE00";

    String snippet = extractor.extract(text, 3, 8, 2);

    assertThat(snippet).isEqualTo("xMATCHx");
  }

  @Test
  @DisplayName("should not overflow with a huge context size")
  void shouldHandleHugeContext() {
    assertThat(extractor.extract("abc", 1, 2, Integer.MAX_VALUE)).isEqualTo("abc");
  }
}
