package com.flamingo.ai.sessions.service.search;

import com.flamingo.ai.sessions.domain.model.SearchOutcome;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Type-ahead search. Every submission cancels the search still running for the previous one, so
 * only the latest query can complete with results.
 */
@Service
@Slf4j
public class IncrementalSearchService {

  private final ConversationSearchService searchService;
  private final Executor interactiveExecutor;
  private final AtomicReference<SearchCancellation> current = new AtomicReference<>();

  public IncrementalSearchService(
      ConversationSearchService searchService,
      @Qualifier("interactiveSearchExecutor") Executor interactiveExecutor) {
    this.searchService = searchService;
    this.interactiveExecutor = interactiveExecutor;
  }

  public CompletableFuture<SearchOutcome> submit(SearchQuery query) {
    return submit(searchService.corpusRoot(), query);
  }

  /**
   * Starts a search, superseding the previous submission.
   *
   * @return completes with the outcome, or exceptionally with the search's exception
   */
  public CompletableFuture<SearchOutcome> submit(Path root, SearchQuery query) {
    SearchCancellation cancellation = new SearchCancellation();
    SearchCancellation previous = current.getAndSet(cancellation);
    if (previous != null) {
      previous.cancel();
      log.debug("Superseded previous incremental search");
    }
    return CompletableFuture.supplyAsync(
        () -> searchService.search(root, query, cancellation), interactiveExecutor);
  }

  /** Cancels the search in flight, if any. */
  public void cancelCurrent() {
    SearchCancellation cancellation = current.getAndSet(null);
    if (cancellation != null) {
      cancellation.cancel();
    }
  }
}
