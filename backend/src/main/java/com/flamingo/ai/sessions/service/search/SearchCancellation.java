package com.flamingo.ai.sessions.service.search;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one search. Checked at every file boundary; once set, the
 * search stops enumerating and scanning files and discards what it found.
 */
public class SearchCancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  /** A token for callers that never cancel. */
  public static SearchCancellation none() {
    return new SearchCancellation();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
