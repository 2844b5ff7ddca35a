package com.flamingo.ai.sessions.service.search.strategy;

import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a query to the {@link MatchStrategy} of its mode.
 *
 * <p>When the strategy reports its capability unavailable (semantic search without an embedding
 * model), the query is answered in smart mode instead and the downgrade is flagged on the result.
 */
@Service
@Slf4j
public class MatchStrategyRouter {

  private final Map<SearchMode, MatchStrategy> strategies = new EnumMap<>(SearchMode.class);
  private final MeterRegistry meterRegistry;

  public MatchStrategyRouter(List<MatchStrategy> strategies, MeterRegistry meterRegistry) {
    for (MatchStrategy strategy : strategies) {
      MatchStrategy previous = this.strategies.put(strategy.mode(), strategy);
      if (previous != null) {
        throw new IllegalStateException("Two match strategies registered for " + strategy.mode());
      }
    }
    if (!this.strategies.containsKey(SearchMode.SMART)) {
      throw new IllegalStateException("No match strategy registered for " + SearchMode.SMART);
    }
    this.meterRegistry = meterRegistry;
  }

  /** A matcher ready to run, and the mode that actually produced it. */
  public record PreparedMatcher(
      MessageMatcher matcher, SearchMode effectiveMode, boolean downgraded) {}

  /**
   * Prepares the matcher for a validated query.
   *
   * @throws com.flamingo.ai.sessions.exception.InvalidQueryException if the query cannot be
   *     compiled for its mode
   */
  public PreparedMatcher prepare(SearchQuery query) {
    SearchMode mode = query.getMode();
    MatchStrategy strategy = strategies.get(mode);
    Optional<MessageMatcher> matcher =
        strategy == null ? Optional.empty() : strategy.prepare(query);
    if (matcher.isPresent()) {
      return new PreparedMatcher(matcher.get(), mode, false);
    }
    log.warn("{} search unavailable, falling back to smart search", mode.getValue());
    meterRegistry.counter("search.semantic.downgraded").increment();
    MessageMatcher fallback =
        strategies
            .get(SearchMode.SMART)
            .prepare(query)
            .orElseThrow(() -> new IllegalStateException("Smart matching is always available"));
    return new PreparedMatcher(fallback, SearchMode.SMART, true);
  }
}
