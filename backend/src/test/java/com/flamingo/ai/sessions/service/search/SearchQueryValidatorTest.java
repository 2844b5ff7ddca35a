package com.flamingo.ai.sessions.service.search;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.exception.InvalidQueryException;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("SearchQueryValidator Tests")
class SearchQueryValidatorTest {

  @ParameterizedTest
  @EnumSource(SearchMode.class)
  @DisplayName("should reject empty text in every mode")
  void shouldRejectEmptyText(SearchMode mode) {
    assertThatThrownBy(() -> SearchQueryValidator.validate(SearchQuery.of("", mode)))
        .isInstanceOf(InvalidQueryException.class);
  }

  @Test
  @DisplayName("should reject blank text for smart search but accept it for exact search")
  void shouldHandleBlankText() {
    assertThatThrownBy(() -> SearchQueryValidator.validate(SearchQuery.of("   ", SearchMode.SMART)))
        .isInstanceOf(InvalidQueryException.class);
    assertThatCode(() -> SearchQueryValidator.validate(SearchQuery.of("   ", SearchMode.EXACT)))
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("should reject non-positive max results and negative context")
  void shouldRejectBounds() {
    SearchQuery base = SearchQuery.of("login", SearchMode.SMART);

    assertThatThrownBy(() -> SearchQueryValidator.validate(base.toBuilder().maxResults(0).build()))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("maxResults");
    assertThatThrownBy(
            () -> SearchQueryValidator.validate(base.toBuilder().contextSize(-1).build()))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("contextSize");
  }

  @Test
  @DisplayName("should reject a tool speaker filter and an inverted date range")
  void shouldRejectFilters() {
    SearchQuery base = SearchQuery.of("login", SearchMode.SMART);

    assertThatThrownBy(
            () ->
                SearchQueryValidator.validate(
                    base.toBuilder().speakerFilter(Speaker.TOOL).build()))
        .isInstanceOf(InvalidQueryException.class);
    assertThatThrownBy(
            () ->
                SearchQueryValidator.validate(
                    base.toBuilder()
                        .dateFrom(Instant.parse("2024-06-01T00:00:00Z"))
                        .dateTo(Instant.parse("2024-05-01T00:00:00Z"))
                        .build()))
        .isInstanceOf(InvalidQueryException.class);
  }

  @Test
  @DisplayName("should accept a complete query")
  void shouldAcceptValidQuery() {
    SearchQuery query =
        SearchQuery.builder()
            .text("login")
            .speakerFilter(Speaker.ASSISTANT)
            .contextSize(0)
            .maxResults(1)
            .dateFrom(Instant.parse("2024-05-01T00:00:00Z"))
            .dateTo(Instant.parse("2024-05-01T00:00:00Z"))
            .build();

    assertThatCode(() -> SearchQueryValidator.validate(query)).doesNotThrowAnyException();
  }
}
