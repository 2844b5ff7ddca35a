package com.flamingo.ai.sessions.service.search.strategy;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.exception.InvalidQueryException;
import com.flamingo.ai.sessions.service.search.ScoringConfig;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Regular expression matching. The pattern is compiled once per search; a message matches iff the
 * pattern is found anywhere in its text.
 */
@Component
@RequiredArgsConstructor
public class RegexMatchStrategy implements MatchStrategy {

  private final ScoringConfig scoringConfig;

  @Override
  public SearchMode mode() {
    return SearchMode.REGEX;
  }

  @Override
  public Optional<MessageMatcher> prepare(SearchQuery query) {
    Pattern pattern = compile(query);
    int countLimit = scoringConfig.maxCountedOccurrences() + 1;

    return Optional.of(
        message -> {
          Matcher matcher = pattern.matcher(message.getText());
          if (!matcher.find()) {
            return Optional.empty();
          }
          int start = matcher.start();
          int end = matcher.end();
          int occurrences = 1;
          while (occurrences < countLimit && matcher.find()) {
            occurrences++;
          }
          return Optional.of(new Match(scoringConfig.occurrenceScore(occurrences), start, end));
        });
  }

  /**
   * Compiles the query text with the query's case sensitivity.
   *
   * @throws InvalidQueryException if the pattern does not compile
   */
  public static Pattern compile(SearchQuery query) {
    int flags = query.isCaseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    try {
      return Pattern.compile(query.getText(), flags);
    } catch (PatternSyntaxException e) {
      throw new InvalidQueryException("Invalid regular expression: " + e.getDescription(), e);
    }
  }
}
