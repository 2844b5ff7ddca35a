package com.flamingo.ai.sessions.service.catalog;

import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import com.flamingo.ai.sessions.domain.model.Message;
import com.flamingo.ai.sessions.domain.model.ProjectSummary;
import com.flamingo.ai.sessions.domain.model.SessionSummary;
import com.flamingo.ai.sessions.exception.CorpusNotFoundException;
import com.flamingo.ai.sessions.exception.ProjectNotFoundException;
import com.flamingo.ai.sessions.exception.SearchException;
import com.flamingo.ai.sessions.exception.TranscriptReadException;
import com.flamingo.ai.sessions.parser.ParseStatistics;
import com.flamingo.ai.sessions.parser.TranscriptReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of TranscriptCatalogService. Nothing is cached; every call reads the disk. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranscriptCatalogServiceImpl implements TranscriptCatalogService {

  private final TranscriptReader transcriptReader;
  private final SearchConfig searchConfig;

  @Override
  public List<ProjectSummary> listProjects(Path root) {
    if (!Files.isDirectory(root)) {
      throw new CorpusNotFoundException(root);
    }
    Set<String> excluded = Set.copyOf(searchConfig.getCorpus().getExcludedDirectories());
    List<ProjectSummary> projects = new ArrayList<>();
    for (Path directory : list(root)) {
      String name = directory.getFileName().toString();
      if (!Files.isDirectory(directory) || excluded.contains(name)) {
        continue;
      }
      List<Path> transcripts = transcriptsIn(directory);
      long totalSize = transcripts.stream().mapToLong(this::sizeOf).sum();
      projects.add(new ProjectSummary(name, transcripts.size(), totalSize));
    }
    projects.sort(Comparator.comparing(ProjectSummary::name));
    return projects;
  }

  @Override
  public List<SessionSummary> listSessions(Path root, String project) {
    Path directory = resolveProject(root, project);
    List<SessionSummary> sessions = new ArrayList<>();
    for (Path transcript : transcriptsIn(directory)) {
      summarize(project, transcript).ifPresent(sessions::add);
    }
    sessions.sort(
        Comparator.comparing(SessionSummary::getModifiedAt, Comparator.reverseOrder())
            .thenComparing(SessionSummary::getSessionId));
    log.debug("Listed {} sessions of project {}", sessions.size(), project);
    return sessions;
  }

  private Path resolveProject(Path root, String project) {
    if (!Files.isDirectory(root)) {
      throw new CorpusNotFoundException(root);
    }
    if (project == null
        || project.isBlank()
        || project.contains("/")
        || project.contains("\\")
        || project.equals(".")
        || project.equals("..")
        || searchConfig.getCorpus().getExcludedDirectories().contains(project)) {
      throw new ProjectNotFoundException(String.valueOf(project));
    }
    Path directory = root.resolve(project);
    if (!Files.isDirectory(directory)) {
      throw new ProjectNotFoundException(project);
    }
    return directory;
  }

  private Optional<SessionSummary> summarize(String project, Path transcript) {
    ParseStatistics statistics = new ParseStatistics();
    Set<Speaker> speakers = EnumSet.noneOf(Speaker.class);
    Instant first = null;
    Instant last = null;
    int count = 0;
    try (Stream<Message> messages = transcriptReader.read(transcript, statistics)) {
      for (Message message : (Iterable<Message>) messages::iterator) {
        count++;
        speakers.add(message.getSpeaker());
        Instant timestamp = message.getTimestamp();
        if (first == null || timestamp.isBefore(first)) {
          first = timestamp;
        }
        if (last == null || timestamp.isAfter(last)) {
          last = timestamp;
        }
      }
    } catch (TranscriptReadException e) {
      log.warn("Skipping unreadable transcript {}: {}", transcript, e.getCause().getMessage());
      return Optional.empty();
    }
    Instant modifiedAt;
    try {
      modifiedAt = Files.getLastModifiedTime(transcript).toInstant();
    } catch (IOException e) {
      log.warn("Cannot stat transcript {}: {}", transcript, e.getMessage());
      return Optional.empty();
    }
    return Optional.of(
        SessionSummary.builder()
            .sessionId(transcriptReader.sessionIdOf(transcript))
            .project(project)
            .messageCount(count)
            .speakers(speakers)
            .firstMessageAt(first)
            .lastMessageAt(last)
            .sizeBytes(sizeOf(transcript))
            .modifiedAt(modifiedAt)
            .malformedEntries(statistics.getMalformedEntries())
            .build());
  }

  private List<Path> transcriptsIn(Path directory) {
    String suffix = searchConfig.getCorpus().getFileSuffix();
    return list(directory).stream()
        .filter(Files::isRegularFile)
        .filter(file -> file.getFileName().toString().endsWith(suffix))
        .toList();
  }

  private List<Path> list(Path directory) {
    try (Stream<Path> entries = Files.list(directory)) {
      return entries.sorted().toList();
    } catch (IOException e) {
      throw new SearchException("Failed to list " + directory, e);
    }
  }

  private long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      log.warn("Cannot read size of {}: {}", file, e.getMessage());
      return 0L;
    }
  }
}
