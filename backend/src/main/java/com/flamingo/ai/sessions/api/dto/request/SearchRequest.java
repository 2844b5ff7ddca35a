package com.flamingo.ai.sessions.api.dto.request;

import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a transcript search. Empty text and out-of-range values are rejected by the
 * search engine as invalid queries, not here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @Size(max = 10000, message = "Search text must not exceed 10000 characters")
  private String text;

  /** Defaults to smart. */
  private SearchMode mode;

  private boolean caseSensitive;

  /** Optional: human or assistant. */
  private Speaker speaker;

  @Max(value = 10000, message = "contextSize must not exceed 10000")
  private Integer contextSize;

  @Max(value = 1000, message = "maxResults must not exceed 1000")
  private Integer maxResults;

  private Instant dateFrom;
  private Instant dateTo;

  /** Builds the engine query, filling unset values from the configured defaults. */
  public SearchQuery toQuery(SearchConfig.Defaults defaults) {
    return SearchQuery.builder()
        .text(text)
        .mode(mode == null ? SearchMode.SMART : mode)
        .caseSensitive(caseSensitive)
        .speakerFilter(speaker)
        .contextSize(contextSize == null ? defaults.getContextSize() : contextSize)
        .maxResults(maxResults == null ? defaults.getMaxResults() : maxResults)
        .dateFrom(dateFrom)
        .dateTo(dateTo)
        .build();
  }
}
