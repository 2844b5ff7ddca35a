package com.flamingo.ai.sessions.service.search.strategy;

import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.service.search.strategy.Tokenizer.Token;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** A query prepared for lexical analysis: its distinct tokens and its phrase. Immutable. */
public final class QueryTerms {

  private final String phrase;
  private final boolean caseSensitive;
  private final List<String> tokens;
  private final Map<String, Integer> ordinals;

  private QueryTerms(String phrase, boolean caseSensitive, List<String> tokens) {
    this.phrase = phrase;
    this.caseSensitive = caseSensitive;
    this.tokens = List.copyOf(tokens);
    Map<String, Integer> byToken = new HashMap<>();
    for (int i = 0; i < tokens.size(); i++) {
      byToken.put(tokens.get(i), i);
    }
    this.ordinals = Map.copyOf(byToken);
  }

  /**
   * Prepares the terms of a query.
   *
   * @param query the query
   * @param dropStopWords remove stop words from the tokens, unless that would remove all of them
   * @return the prepared terms
   */
  public static QueryTerms of(SearchQuery query, boolean dropStopWords) {
    boolean caseSensitive = query.isCaseSensitive();
    Set<String> distinct = new LinkedHashSet<>();
    for (Token token : Tokenizer.tokenize(query.getText(), caseSensitive)) {
      distinct.add(token.value());
    }
    List<String> tokens = new ArrayList<>(distinct);
    if (dropStopWords) {
      List<String> content = tokens.stream().filter(t -> !Tokenizer.isStopWord(t)).toList();
      if (!content.isEmpty()) {
        tokens = content;
      }
    }
    return new QueryTerms(query.getText().strip(), caseSensitive, tokens);
  }

  public List<String> tokens() {
    return tokens;
  }

  public String phrase() {
    return phrase;
  }

  /** Compares the query with a message text. */
  public TermAnalysis analyze(String text) {
    List<Token> messageTokens = Tokenizer.tokenize(text, caseSensitive);
    int[] ords = new int[messageTokens.size()];
    int[] firstIndex = new int[tokens.size()];
    Arrays.fill(firstIndex, -1);
    int matched = 0;
    for (int i = 0; i < ords.length; i++) {
      Integer ordinal = ordinals.get(messageTokens.get(i).value());
      ords[i] = ordinal == null ? -1 : ordinal;
      if (ordinal != null && firstIndex[ordinal] < 0) {
        firstIndex[ordinal] = i;
        matched++;
      }
    }

    int windowFirst = -1;
    int windowLast = -1;
    if (matched == 1) {
      for (int index : firstIndex) {
        if (index >= 0) {
          windowFirst = index;
          windowLast = index;
        }
      }
    } else if (matched > 1) {
      int[] window = smallestWindow(ords, matched);
      windowFirst = window[0];
      windowLast = window[1];
    }

    int phraseStart = phrase.isEmpty() ? -1 : TextSearch.indexOf(text, phrase, 0, !caseSensitive);
    return new TermAnalysis(
        tokens.size(),
        matched,
        phraseStart,
        phraseStart < 0 ? -1 : phraseStart + phrase.length(),
        windowFirst < 0 ? -1 : messageTokens.get(windowFirst).start(),
        windowLast < 0 ? -1 : messageTokens.get(windowLast).end(),
        windowFirst < 0 ? 0 : windowLast - windowFirst + 1);
  }

  // Smallest run of message tokens containing every matched query token at least once.
  private int[] smallestWindow(int[] ords, int matched) {
    int[] counts = new int[tokens.size()];
    int covered = 0;
    int left = 0;
    int[] best = {-1, -1};
    for (int right = 0; right < ords.length; right++) {
      if (ords[right] < 0) {
        continue;
      }
      if (counts[ords[right]]++ == 0) {
        covered++;
      }
      while (covered == matched) {
        if (best[0] < 0 || right - left < best[1] - best[0]) {
          best[0] = left;
          best[1] = right;
        }
        if (ords[left] >= 0 && --counts[ords[left]] == 0) {
          covered--;
        }
        left++;
      }
    }
    return best;
  }
}
