package com.flamingo.ai.sessions.service.search.strategy;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.model.Message;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.service.search.ScoringConfig;
import com.flamingo.ai.sessions.service.semantic.EmbeddingService;
import dev.langchain4j.data.embedding.Embedding;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Embedding similarity. A message matches when the cosine similarity between its embedding and the
 * query's reaches {@code semanticThreshold}; the similarity is the score.
 *
 * <p>The highlighted span is the lexical window of the query terms when the message contains any,
 * otherwise the message's first line.
 *
 * <p>A message that cannot be embedded (model failure, open circuit breaker) is matched in smart
 * mode instead, and the matcher reports itself {@link MessageMatcher#degraded() degraded}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SemanticMatchStrategy implements MatchStrategy {

  private final EmbeddingService embeddingService;
  private final SmartMatchStrategy smartMatchStrategy;
  private final ScoringConfig scoringConfig;

  @Override
  public SearchMode mode() {
    return SearchMode.SEMANTIC;
  }

  @Override
  public Optional<MessageMatcher> prepare(SearchQuery query) {
    if (!embeddingService.isAvailable()) {
      return Optional.empty();
    }
    Optional<Embedding> queryEmbedding = embeddingService.embed(query.getText());
    if (queryEmbedding.isEmpty()) {
      log.warn("Could not embed query, semantic matching unavailable for this search");
      return Optional.empty();
    }
    MessageMatcher fallback =
        smartMatchStrategy
            .prepare(query)
            .orElseThrow(() -> new IllegalStateException("Smart matching is always available"));
    QueryTerms terms = QueryTerms.of(query, scoringConfig.stopWordsEnabled());
    return Optional.of(
        new SemanticMatcher(
            queryEmbedding.get(), terms, Math.max(query.getContextSize(), 1), fallback));
  }

  static Match locate(double similarity, String text, QueryTerms terms, int leadLimit) {
    TermAnalysis analysis = terms.analyze(text);
    if (analysis.hasEvidence()) {
      return new Match(similarity, analysis.spanStart(), analysis.spanEnd());
    }
    int newline = text.indexOf('\n');
    int end = Math.min(newline > 0 ? newline : text.length(), leadLimit);
    if (end < text.length() && Character.isHighSurrogate(text.charAt(end - 1))) {
      end = end > 1 ? end - 1 : end + 1;
    }
    return new Match(similarity, 0, end);
  }

  private class SemanticMatcher implements MessageMatcher {

    private final Embedding reference;
    private final QueryTerms terms;
    private final int leadLimit;
    private final MessageMatcher fallback;
    private final AtomicBoolean degraded = new AtomicBoolean();

    SemanticMatcher(Embedding reference, QueryTerms terms, int leadLimit, MessageMatcher fallback) {
      this.reference = reference;
      this.terms = terms;
      this.leadLimit = leadLimit;
      this.fallback = fallback;
    }

    @Override
    public Optional<Match> match(Message message) {
      Optional<Embedding> embedding = embeddingService.embed(message.getText());
      if (embedding.isEmpty()) {
        if (degraded.compareAndSet(false, true)) {
          log.warn("Embedding failed during search, matching such messages in smart mode");
        }
        return fallback.match(message);
      }
      double similarity = embeddingService.similarity(reference, embedding.get());
      if (similarity < scoringConfig.semanticThreshold()) {
        return Optional.empty();
      }
      return Optional.of(locate(similarity, message.getText(), terms, leadLimit));
    }

    @Override
    public boolean degraded() {
      return degraded.get();
    }
  }
}
