package com.flamingo.ai.sessions.service.search.strategy;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import java.util.Optional;

/** One matching strategy per {@link SearchMode}. */
public interface MatchStrategy {

  SearchMode mode();

  /**
   * Prepares a matcher for a query. Called once per search, before any file is read.
   *
   * @param query the validated query
   * @return the matcher, or empty when the strategy's capability is unavailable
   * @throws com.flamingo.ai.sessions.exception.InvalidQueryException if the query cannot be
   *     compiled for this strategy
   */
  Optional<MessageMatcher> prepare(SearchQuery query);
}
