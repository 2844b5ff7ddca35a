package com.flamingo.ai.sessions.service.search;

import org.springframework.stereotype.Component;

/**
 * Cuts the context window around a match out of a message text.
 *
 * <p>The window extends {@code contextSize} characters on each side of the match and is clipped to
 * the message text. A window edge that would split a surrogate pair is moved inwards, never past
 * the match itself.
 */
@Component
public class SnippetExtractor {

  public String extract(String text, int matchStart, int matchEnd, int contextSize) {
    int start = Math.max(0, matchStart - contextSize);
    int end = (int) Math.min(text.length(), (long) matchEnd + contextSize);
    if (start < matchStart && Character.isLowSurrogate(text.charAt(start))) {
      start++;
    }
    if (end > matchEnd && end < text.length() && Character.isLowSurrogate(text.charAt(end))) {
      end--;
    }
    return text.substring(start, end);
  }
}
