package com.flamingo.ai.sessions.service.search;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.exception.InvalidQueryException;

/** Rejects queries that cannot be run. Mode-specific compilation happens in the strategies. */
final class SearchQueryValidator {

  private SearchQueryValidator() {}

  static void validate(SearchQuery query) {
    if (query == null) {
      throw new InvalidQueryException("Search query is required");
    }
    String text = query.getText();
    if (text == null || text.isEmpty()) {
      throw new InvalidQueryException("Search text must not be empty");
    }
    if (query.getMode() == null) {
      throw new InvalidQueryException("Search mode is required");
    }
    if (text.isBlank()
        && (query.getMode() == SearchMode.SMART || query.getMode() == SearchMode.SEMANTIC)) {
      throw new InvalidQueryException("Search text must contain at least one word");
    }
    if (query.getMaxResults() < 1) {
      throw new InvalidQueryException("maxResults must be at least 1");
    }
    if (query.getContextSize() < 0) {
      throw new InvalidQueryException("contextSize must not be negative");
    }
    if (query.getSpeakerFilter() == Speaker.TOOL) {
      throw new InvalidQueryException("Speaker filter must be human or assistant");
    }
    if (query.getDateFrom() != null
        && query.getDateTo() != null
        && query.getDateFrom().isAfter(query.getDateTo())) {
      throw new InvalidQueryException("dateFrom must not be after dateTo");
    }
  }
}
