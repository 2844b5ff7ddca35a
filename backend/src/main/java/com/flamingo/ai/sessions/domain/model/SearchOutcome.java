package com.flamingo.ai.sessions.domain.model;

import java.util.List;

/**
 * Result of one search call: the ranked hits plus corpus-level observations.
 *
 * @param results ranked hits, at most {@code maxResults}
 * @param semanticDowngraded semantic mode was requested but smart matching was used
 * @param filesScanned transcripts read to completion
 * @param unreadableFiles transcripts skipped because they could not be read
 * @param malformedEntries lines skipped because they were not valid entries
 * @param cancelled the search was cancelled and its results discarded
 */
public record SearchOutcome(
    List<SearchResult> results,
    boolean semanticDowngraded,
    int filesScanned,
    int unreadableFiles,
    long malformedEntries,
    boolean cancelled) {

  public SearchOutcome {
    results = List.copyOf(results);
  }

  public static SearchOutcome cancelled(boolean semanticDowngraded) {
    return new SearchOutcome(List.of(), semanticDowngraded, 0, 0, 0, true);
  }
}
