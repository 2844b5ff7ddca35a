package com.flamingo.ai.sessions.service.search.strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits text into word tokens: maximal runs of letters and digits. Every other character is a
 * separator. Offsets refer to the original text.
 */
public final class Tokenizer {

  /** Common English words that carry no search intent. */
  public static final Set<String> STOP_WORDS =
      Set.of(
          "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "is", "are", "was",
          "were", "be", "been", "being", "have", "has", "had", "do", "does", "did", "will",
          "would", "could", "should", "may", "might", "i", "you", "we", "they", "it", "this",
          "that", "these", "those");

  private Tokenizer() {}

  /**
   * A token and its position.
   *
   * @param value token text, lower-cased unless tokenizing case-sensitively
   * @param start offset of the first character in the source text
   * @param end offset after the last character in the source text
   */
  public record Token(String value, int start, int end) {}

  public static List<Token> tokenize(String text, boolean caseSensitive) {
    List<Token> tokens = new ArrayList<>();
    if (text == null) {
      return tokens;
    }
    int length = text.length();
    int i = 0;
    while (i < length) {
      int codePoint = text.codePointAt(i);
      if (!Character.isLetterOrDigit(codePoint)) {
        i += Character.charCount(codePoint);
        continue;
      }
      int start = i;
      while (i < length) {
        codePoint = text.codePointAt(i);
        if (!Character.isLetterOrDigit(codePoint)) {
          break;
        }
        i += Character.charCount(codePoint);
      }
      String value = text.substring(start, i);
      tokens.add(new Token(caseSensitive ? value : value.toLowerCase(Locale.ROOT), start, i));
    }
    return tokens;
  }

  public static boolean isStopWord(String token) {
    return STOP_WORDS.contains(token.toLowerCase(Locale.ROOT));
  }
}
