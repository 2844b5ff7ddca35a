package com.flamingo.ai.sessions.service.search.strategy;

/**
 * Substring search with optional case folding. Folding is applied character by character, so
 * returned offsets always index the original text.
 */
public final class TextSearch {

  private TextSearch() {}

  /** Returns the first index of {@code needle} at or after {@code from}, or -1. */
  public static int indexOf(String text, String needle, int from, boolean ignoreCase) {
    if (!ignoreCase) {
      return text.indexOf(needle, from);
    }
    int last = text.length() - needle.length();
    for (int i = Math.max(from, 0); i <= last; i++) {
      if (text.regionMatches(true, i, needle, 0, needle.length())) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Counts non-overlapping occurrences of {@code needle}, stopping once {@code limit} is reached.
   */
  public static int countOccurrences(String text, String needle, boolean ignoreCase, int limit) {
    if (needle.isEmpty()) {
      return 0;
    }
    int count = 0;
    int index = indexOf(text, needle, 0, ignoreCase);
    while (index >= 0 && count < limit) {
      count++;
      index = indexOf(text, needle, index + needle.length(), ignoreCase);
    }
    return count;
  }
}
