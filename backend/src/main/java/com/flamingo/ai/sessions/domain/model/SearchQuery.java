package com.flamingo.ai.sessions.domain.model;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Immutable description of one search request. Validated by the search service. */
@Value
@Builder(toBuilder = true)
public class SearchQuery {

  public static final int DEFAULT_CONTEXT_SIZE = 150;
  public static final int DEFAULT_MAX_RESULTS = 20;

  /** Free text, phrase or regular expression depending on {@link #mode}. */
  String text;

  @Builder.Default SearchMode mode = SearchMode.SMART;

  @Builder.Default boolean caseSensitive = false;

  /** Restricts matching to one speaker; null searches every speaker. */
  Speaker speakerFilter;

  /** Characters of context kept on each side of the match. */
  @Builder.Default int contextSize = DEFAULT_CONTEXT_SIZE;

  @Builder.Default int maxResults = DEFAULT_MAX_RESULTS;

  /** Inclusive lower bound on message timestamps, optional. */
  Instant dateFrom;

  /** Inclusive upper bound on message timestamps, optional. */
  Instant dateTo;

  public static SearchQuery of(String text, SearchMode mode) {
    return SearchQuery.builder().text(text).mode(mode).build();
  }

  /** Returns true if the message passes the speaker and date filters. */
  public boolean accepts(Message message) {
    if (speakerFilter != null && message.getSpeaker() != speakerFilter) {
      return false;
    }
    Instant timestamp = message.getTimestamp();
    if (dateFrom != null && timestamp.isBefore(dateFrom)) {
      return false;
    }
    return dateTo == null || !timestamp.isAfter(dateTo);
  }
}
