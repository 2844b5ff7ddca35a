package com.flamingo.ai.sessions.service.search.strategy;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.service.search.ScoringConfig;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Heuristic lexical relevance.
 *
 * <p>Score = token overlap ratio, plus {@code exactPhraseBonus} when the whole query occurs as a
 * phrase, plus {@code proximityBonus} when two or more matched tokens fall inside a window shorter
 * than {@code matched * proximityWindowMultiplier} tokens. Messages scoring strictly below {@code
 * relevanceThreshold}, or with neither a matched token nor the phrase, are dropped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SmartMatchStrategy implements MatchStrategy {

  private final ScoringConfig scoringConfig;

  @Override
  public SearchMode mode() {
    return SearchMode.SMART;
  }

  @Override
  public Optional<MessageMatcher> prepare(SearchQuery query) {
    QueryTerms terms = QueryTerms.of(query, scoringConfig.stopWordsEnabled());
    log.debug("Smart matching on tokens {} with phrase '{}'", terms.tokens(), terms.phrase());
    return Optional.of(message -> score(terms.analyze(message.getText())));
  }

  Optional<Match> score(TermAnalysis analysis) {
    if (!analysis.hasEvidence()) {
      return Optional.empty();
    }
    double score = analysis.overlapRatio();
    if (analysis.hasPhrase()) {
      score += scoringConfig.exactPhraseBonus();
    }
    if (analysis.matchedTokens() >= 2
        && analysis.windowTokens()
            < analysis.matchedTokens() * scoringConfig.proximityWindowMultiplier()) {
      score += scoringConfig.proximityBonus();
    }
    if (score < scoringConfig.relevanceThreshold()) {
      return Optional.empty();
    }
    return Optional.of(new Match(score, analysis.spanStart(), analysis.spanEnd()));
  }
}
