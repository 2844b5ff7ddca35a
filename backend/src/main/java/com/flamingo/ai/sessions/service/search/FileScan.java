package com.flamingo.ai.sessions.service.search;

import com.flamingo.ai.sessions.domain.model.SearchResult;
import java.util.List;

/** What scanning one transcript produced. */
record FileScan(List<SearchResult> hits, boolean completed, boolean unreadable, long malformed) {

  static FileScan completed(List<SearchResult> hits, long malformed) {
    return new FileScan(hits, true, false, malformed);
  }

  static FileScan unreadable(long malformed) {
    return new FileScan(List.of(), false, true, malformed);
  }

  static FileScan skipped() {
    return new FileScan(List.of(), false, false, 0);
  }
}
