package com.flamingo.ai.sessions.service.search.strategy;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.service.search.ScoringConfig;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Substring containment. A message matches iff the query text occurs in it; extra occurrences add
 * a small tie-breaking amount to the fixed score.
 */
@Component
@RequiredArgsConstructor
public class ExactMatchStrategy implements MatchStrategy {

  private final ScoringConfig scoringConfig;

  @Override
  public SearchMode mode() {
    return SearchMode.EXACT;
  }

  @Override
  public Optional<MessageMatcher> prepare(SearchQuery query) {
    String needle = query.getText();
    boolean ignoreCase = !query.isCaseSensitive();
    int countLimit = scoringConfig.maxCountedOccurrences() + 1;

    return Optional.of(
        message -> {
          String text = message.getText();
          int first = TextSearch.indexOf(text, needle, 0, ignoreCase);
          if (first < 0) {
            return Optional.empty();
          }
          int occurrences = TextSearch.countOccurrences(text, needle, ignoreCase, countLimit);
          double score = scoringConfig.occurrenceScore(occurrences);
          return Optional.of(new Match(score, first, first + needle.length()));
        });
  }
}
