package com.flamingo.ai.sessions.service.search;

import java.nio.file.Path;
import java.util.List;

/**
 * Transcript files selected for one search.
 *
 * @param files transcripts to scan, sorted by path
 * @param unreadable directories or files that could not be visited
 * @param cancelled enumeration stopped because the search was cancelled
 */
public record CorpusListing(List<Path> files, int unreadable, boolean cancelled) {

  public CorpusListing {
    files = List.copyOf(files);
  }
}
