package com.flamingo.ai.sessions.service.search;

import com.flamingo.ai.sessions.config.SearchConfig;

/**
 * Immutable scoring parameters handed to the match strategies.
 *
 * @param relevanceThreshold smart-mode cutoff, messages strictly below are dropped
 * @param exactPhraseBonus added when the whole query occurs as a phrase
 * @param proximityBonus added when the matched tokens sit close together
 * @param proximityWindowMultiplier window limit per matched token
 * @param occurrenceWeight exact/regex score added per extra occurrence
 * @param maxCountedOccurrences cap on extra occurrences that add score
 * @param semanticThreshold semantic-mode cutoff on cosine similarity
 * @param stopWordsEnabled whether smart mode ignores common English words in the query
 */
public record ScoringConfig(
    double relevanceThreshold,
    double exactPhraseBonus,
    double proximityBonus,
    int proximityWindowMultiplier,
    double occurrenceWeight,
    int maxCountedOccurrences,
    double semanticThreshold,
    boolean stopWordsEnabled) {

  public static ScoringConfig defaults() {
    return from(new SearchConfig.Scoring());
  }

  public static ScoringConfig from(SearchConfig.Scoring scoring) {
    return new ScoringConfig(
        scoring.getRelevanceThreshold(),
        scoring.getExactPhraseBonus(),
        scoring.getProximityBonus(),
        scoring.getProximityWindowMultiplier(),
        scoring.getOccurrenceWeight(),
        scoring.getMaxCountedOccurrences(),
        scoring.getSemanticThreshold(),
        scoring.isStopWordsEnabled());
  }

  /** Score of an exact or regex match found {@code occurrences} times. */
  public double occurrenceScore(int occurrences) {
    int extra = Math.min(Math.max(occurrences - 1, 0), maxCountedOccurrences);
    return 1.0 + occurrenceWeight * extra;
  }
}
