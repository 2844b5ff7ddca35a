package com.flamingo.ai.sessions.service.search.strategy;

/**
 * How a message text relates to a query's terms.
 *
 * @param queryTokens number of distinct query tokens
 * @param matchedTokens number of distinct query tokens found in the message
 * @param phraseStart offset of the whole query phrase, or -1
 * @param phraseEnd offset after the phrase, or -1
 * @param windowStart offset where the smallest window holding all matched tokens starts, or -1
 * @param windowEnd offset where that window ends, or -1
 * @param windowTokens length of that window in tokens, 0 when nothing matched
 */
public record TermAnalysis(
    int queryTokens,
    int matchedTokens,
    int phraseStart,
    int phraseEnd,
    int windowStart,
    int windowEnd,
    int windowTokens) {

  public double overlapRatio() {
    return queryTokens == 0 ? 0.0 : (double) matchedTokens / queryTokens;
  }

  public boolean hasPhrase() {
    return phraseStart >= 0;
  }

  /** True when either the phrase or at least one token was found. */
  public boolean hasEvidence() {
    return hasPhrase() || matchedTokens > 0;
  }

  /** Start of the text that satisfied the query: the phrase if present, else the window. */
  public int spanStart() {
    return hasPhrase() ? phraseStart : windowStart;
  }

  public int spanEnd() {
    return hasPhrase() ? phraseEnd : windowEnd;
  }
}
