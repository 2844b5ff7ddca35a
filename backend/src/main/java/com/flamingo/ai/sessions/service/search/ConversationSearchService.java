package com.flamingo.ai.sessions.service.search;

import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.domain.model.Message;
import com.flamingo.ai.sessions.domain.model.SearchOutcome;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.domain.model.SearchResult;
import com.flamingo.ai.sessions.exception.CorpusNotFoundException;
import com.flamingo.ai.sessions.exception.SearchException;
import com.flamingo.ai.sessions.exception.TranscriptReadException;
import com.flamingo.ai.sessions.parser.ParseStatistics;
import com.flamingo.ai.sessions.parser.TranscriptReader;
import com.flamingo.ai.sessions.service.search.strategy.Match;
import com.flamingo.ai.sessions.service.search.strategy.MatchStrategyRouter;
import com.flamingo.ai.sessions.service.search.strategy.MatchStrategyRouter.PreparedMatcher;
import com.flamingo.ai.sessions.service.search.strategy.MessageMatcher;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Searches every transcript under a corpus root and returns the globally ranked top results.
 *
 * <p>Files are scanned in parallel on the search executor, one task per file; within a file,
 * parsing and matching are sequential. All hits are pooled, sorted with {@link
 * SearchResult#RANKING} and only then truncated, so the outcome does not depend on scheduling or
 * file-system order. Files are only ever opened for reading.
 */
@Service
@Slf4j
public class ConversationSearchService {

  private final TranscriptFileScanner fileScanner;
  private final TranscriptReader transcriptReader;
  private final MatchStrategyRouter strategyRouter;
  private final SnippetExtractor snippetExtractor;
  private final SearchConfig searchConfig;
  private final MeterRegistry meterRegistry;
  private final Executor searchExecutor;

  public ConversationSearchService(
      TranscriptFileScanner fileScanner,
      TranscriptReader transcriptReader,
      MatchStrategyRouter strategyRouter,
      SnippetExtractor snippetExtractor,
      SearchConfig searchConfig,
      MeterRegistry meterRegistry,
      @Qualifier("searchExecutor") Executor searchExecutor) {
    this.fileScanner = fileScanner;
    this.transcriptReader = transcriptReader;
    this.strategyRouter = strategyRouter;
    this.snippetExtractor = snippetExtractor;
    this.searchConfig = searchConfig;
    this.meterRegistry = meterRegistry;
    this.searchExecutor = searchExecutor;
  }

  /** Searches the configured corpus root. */
  @Timed(value = "search.duration", description = "Time for one transcript search")
  public SearchOutcome search(SearchQuery query) {
    return search(corpusRoot(), query, SearchCancellation.none());
  }

  @Timed(value = "search.duration", description = "Time for one transcript search")
  public SearchOutcome search(Path root, SearchQuery query) {
    return search(root, query, SearchCancellation.none());
  }

  /**
   * Runs one search.
   *
   * @param root directory holding the project directories
   * @param query the query
   * @param cancellation checked at every file boundary
   * @return at most {@code query.maxResults} results in ranking order, plus skip counts
   * @throws com.flamingo.ai.sessions.exception.InvalidQueryException if the query is rejected; no
   *     file has been read at that point
   * @throws CorpusNotFoundException if {@code root} is not a directory
   */
  @Timed(value = "search.duration", description = "Time for one transcript search")
  public SearchOutcome search(Path root, SearchQuery query, SearchCancellation cancellation) {
    SearchQueryValidator.validate(query);
    PreparedMatcher prepared = strategyRouter.prepare(query);
    if (!Files.isDirectory(root)) {
      throw new CorpusNotFoundException(root);
    }
    meterRegistry
        .counter("search.requests", "mode", prepared.effectiveMode().getValue())
        .increment();
    log.debug(
        "Searching {} in {} mode (case sensitive: {}, speaker: {}, max results: {})",
        root,
        prepared.effectiveMode().getValue(),
        query.isCaseSensitive(),
        query.getSpeakerFilter(),
        query.getMaxResults());

    CorpusListing listing = fileScanner.list(root, query, cancellation);
    if (listing.cancelled()) {
      return cancelled(prepared);
    }

    List<CompletableFuture<FileScan>> scans =
        listing.files().stream()
            .map(
                file ->
                    CompletableFuture.supplyAsync(
                        () -> scanFile(file, query, prepared.matcher(), cancellation),
                        searchExecutor))
            .toList();
    List<FileScan> completed = awaitAll(scans, cancellation);
    if (completed == null || cancellation.isCancelled()) {
      return cancelled(prepared);
    }

    return collect(query, prepared, listing, completed);
  }

  private SearchOutcome collect(
      SearchQuery query, PreparedMatcher prepared, CorpusListing listing, List<FileScan> scans) {
    List<SearchResult> pool = new ArrayList<>();
    int filesScanned = 0;
    int unreadable = listing.unreadable();
    long malformed = 0;
    for (FileScan scan : scans) {
      pool.addAll(scan.hits());
      malformed += scan.malformed();
      if (scan.completed()) {
        filesScanned++;
      }
      if (scan.unreadable()) {
        unreadable++;
      }
    }
    List<SearchResult> ranked =
        pool.stream().sorted(SearchResult.RANKING).limit(query.getMaxResults()).toList();

    meterRegistry.counter("search.results").increment(ranked.size());
    meterRegistry.counter("search.files.unreadable").increment(unreadable);
    meterRegistry.counter("search.entries.malformed").increment(malformed);
    log.debug(
        "Search matched {} messages in {} files, returning {}",
        pool.size(),
        filesScanned,
        ranked.size());
    boolean downgraded = prepared.downgraded();
    if (!downgraded && prepared.matcher().degraded()) {
      meterRegistry.counter("search.semantic.downgraded").increment();
      downgraded = true;
    }
    return new SearchOutcome(ranked, downgraded, filesScanned, unreadable, malformed, false);
  }

  private FileScan scanFile(
      Path file, SearchQuery query, MessageMatcher matcher, SearchCancellation cancellation) {
    if (cancellation.isCancelled()) {
      return FileScan.skipped();
    }
    ParseStatistics statistics = new ParseStatistics();
    List<SearchResult> hits = new ArrayList<>();
    try (Stream<Message> messages = transcriptReader.read(file, statistics)) {
      messages
          .filter(query::accepts)
          .filter(Message::hasText)
          .forEach(
              message ->
                  matcher
                      .match(message)
                      .ifPresent(match -> hits.add(toResult(message, match, query))));
    } catch (TranscriptReadException e) {
      log.warn("Skipping unreadable transcript {}: {}", file, e.getCause().getMessage());
      return FileScan.unreadable(statistics.getMalformedEntries());
    } catch (RuntimeException e) {
      throw new SearchException("Failed to search transcript " + file, e);
    }
    if (statistics.getMalformedEntries() > 0) {
      log.warn(
          "Skipped {} malformed lines in {}", statistics.getMalformedEntries(), file.getFileName());
    }
    return FileScan.completed(hits, statistics.getMalformedEntries());
  }

  private SearchResult toResult(Message message, Match match, SearchQuery query) {
    String text = message.getText();
    return new SearchResult(
        message.getSessionId(),
        message.getId(),
        message.getSpeaker(),
        message.getTimestamp(),
        match.score(),
        match.matchedText(text),
        snippetExtractor.extract(text, match.start(), match.end(), query.getContextSize()));
  }

  // Returns null when the wait was interrupted.
  private List<FileScan> awaitAll(
      List<CompletableFuture<FileScan>> scans, SearchCancellation cancellation) {
    List<FileScan> completed = new ArrayList<>(scans.size());
    try {
      for (CompletableFuture<FileScan> scan : scans) {
        completed.add(scan.get());
      }
      return completed;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancellation.cancel();
      scans.forEach(scan -> scan.cancel(true));
      return null;
    } catch (ExecutionException e) {
      cancellation.cancel();
      Throwable cause = e.getCause();
      if (cause instanceof SearchException searchException) {
        throw searchException;
      }
      throw new SearchException("Search worker failed", cause);
    }
  }

  private SearchOutcome cancelled(PreparedMatcher prepared) {
    log.debug("Search cancelled, discarding partial results");
    meterRegistry.counter("search.cancelled").increment();
    return SearchOutcome.cancelled(prepared.downgraded());
  }

  public Path corpusRoot() {
    return Paths.get(searchConfig.getCorpus().getRoot());
  }
}
