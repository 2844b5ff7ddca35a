package com.flamingo.ai.sessions.api.dto.response;

import com.flamingo.ai.sessions.domain.model.SearchOutcome;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a completed search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

  private List<SearchHitResponse> results;

  /** Semantic mode was requested but unavailable; results come from smart matching. */
  private boolean semanticDowngraded;

  private int filesScanned;
  private int unreadableFiles;
  private long malformedEntries;

  public static SearchResponse fromOutcome(SearchOutcome outcome) {
    return SearchResponse.builder()
        .results(outcome.results().stream().map(SearchHitResponse::fromResult).toList())
        .semanticDowngraded(outcome.semanticDowngraded())
        .filesScanned(outcome.filesScanned())
        .unreadableFiles(outcome.unreadableFiles())
        .malformedEntries(outcome.malformedEntries())
        .build();
  }
}
