package com.flamingo.ai.sessions.service.search.strategy;

import com.flamingo.ai.sessions.domain.model.Message;
import java.util.Optional;

/**
 * Matches messages against one prepared query. Shared by all scan workers of a search, so
 * implementations must be thread-safe.
 */
@FunctionalInterface
public interface MessageMatcher {

  /**
   * Scores a message.
   *
   * @param message a message with non-empty text that passed the query filters
   * @return the match, or empty if the message does not satisfy the query
   */
  Optional<Match> match(Message message);

  /**
   * Whether some messages could not be matched in the requested mode and were matched in smart
   * mode instead. Read once all messages have been matched.
   */
  default boolean degraded() {
    return false;
  }
}
