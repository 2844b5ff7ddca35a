package com.flamingo.ai.sessions.service.search.strategy;

/**
 * A scored match inside one message.
 *
 * @param score relevance under the strategy that produced it
 * @param start offset of the matched text in the message text
 * @param end offset after the matched text
 */
public record Match(double score, int start, int end) {

  public String matchedText(String text) {
    return text.substring(start, end);
  }
}
