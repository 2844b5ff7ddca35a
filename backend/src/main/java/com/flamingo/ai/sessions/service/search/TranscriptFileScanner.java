package com.flamingo.ai.sessions.service.search;

import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.exception.SearchException;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Enumerates the transcript files under a corpus root.
 *
 * <p>Directories named in {@code search.corpus.excluded-directories} hold generated copies of the
 * transcripts and are never entered. When the query has a lower date bound, files last modified
 * before that bound (minus the configured slack) are skipped: an append-only transcript cannot hold
 * a message newer than its last write.
 *
 * <p>Symbolic links to transcript files are followed; links to directories are not.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TranscriptFileScanner {

  private final SearchConfig searchConfig;

  /**
   * Lists the transcripts a query has to scan.
   *
   * @param root corpus root, must be an existing directory
   * @param query the query, for its date bounds
   * @param cancellation stops the walk when cancelled
   * @return the files sorted by path
   */
  public CorpusListing list(Path root, SearchQuery query, SearchCancellation cancellation) {
    SearchConfig.Corpus corpus = searchConfig.getCorpus();
    Set<String> excluded = Set.copyOf(corpus.getExcludedDirectories());
    Instant modifiedAfter =
        query.getDateFrom() == null
            ? null
            : query.getDateFrom().minus(corpus.getModifiedTimeSlack());

    TranscriptVisitor visitor =
        new TranscriptVisitor(root, excluded, corpus.getFileSuffix(), modifiedAfter, cancellation);
    try {
      Files.walkFileTree(root, visitor);
    } catch (IOException e) {
      throw new SearchException("Failed to list transcripts under " + root, e);
    }
    Collections.sort(visitor.files);
    log.debug(
        "Listed {} transcripts under {} ({} skipped by date, {} unreadable)",
        visitor.files.size(),
        root,
        visitor.skippedByDate,
        visitor.unreadable);
    return new CorpusListing(visitor.files, visitor.unreadable, cancellation.isCancelled());
  }

  private static class TranscriptVisitor extends SimpleFileVisitor<Path> {

    private final Path root;
    private final Set<String> excluded;
    private final String suffix;
    private final Instant modifiedAfter;
    private final SearchCancellation cancellation;
    private final List<Path> files = new ArrayList<>();
    private int unreadable;
    private int skippedByDate;

    TranscriptVisitor(
        Path root,
        Set<String> excluded,
        String suffix,
        Instant modifiedAfter,
        SearchCancellation cancellation) {
      this.root = root;
      this.excluded = excluded;
      this.suffix = suffix;
      this.modifiedAfter = modifiedAfter;
      this.cancellation = cancellation;
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
      if (cancellation.isCancelled()) {
        return FileVisitResult.TERMINATE;
      }
      if (!dir.equals(root) && excluded.contains(dir.getFileName().toString())) {
        return FileVisitResult.SKIP_SUBTREE;
      }
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
      if (cancellation.isCancelled()) {
        return FileVisitResult.TERMINATE;
      }
      if (!file.getFileName().toString().endsWith(suffix)) {
        return FileVisitResult.CONTINUE;
      }
      if (attrs.isSymbolicLink()) {
        try {
          attrs = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
          log.warn("Cannot follow link {}: {}", file, e.toString());
          unreadable++;
          return FileVisitResult.CONTINUE;
        }
      }
      if (!attrs.isRegularFile()) {
        return FileVisitResult.CONTINUE;
      }
      if (modifiedAfter != null && attrs.lastModifiedTime().toInstant().isBefore(modifiedAfter)) {
        skippedByDate++;
        return FileVisitResult.CONTINUE;
      }
      files.add(file);
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) {
      log.warn("Cannot access {}: {}", file, exc.toString());
      unreadable++;
      return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
      if (exc != null) {
        log.warn("Listing of {} was interrupted: {}", dir, exc.toString());
        unreadable++;
      }
      return FileVisitResult.CONTINUE;
    }
  }
}
