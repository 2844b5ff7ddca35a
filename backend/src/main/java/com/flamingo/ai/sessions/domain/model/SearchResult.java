package com.flamingo.ai.sessions.domain.model;

import com.flamingo.ai.sessions.domain.enums.Speaker;
import java.time.Instant;
import java.util.Comparator;

/**
 * One ranked hit. Identifies the message it came from without holding on to it.
 *
 * @param sessionId owning transcript
 * @param messageId message within the transcript
 * @param speaker who wrote the message
 * @param timestamp message time, second ordering key
 * @param score per-query relevance, only comparable within one search
 * @param matchedText literal text that satisfied the query
 * @param snippet window of the message text around {@code matchedText}
 */
public record SearchResult(
    String sessionId,
    String messageId,
    Speaker speaker,
    Instant timestamp,
    double score,
    String matchedText,
    String snippet) {

  /** Score descending, then timestamp, session id and message id ascending. */
  public static final Comparator<SearchResult> RANKING =
      Comparator.comparingDouble(SearchResult::score)
          .reversed()
          .thenComparing(SearchResult::timestamp)
          .thenComparing(SearchResult::sessionId)
          .thenComparing(SearchResult::messageId);
}
