package com.flamingo.ai.sessions.service.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.sessions.TranscriptFixtures;
import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import com.flamingo.ai.sessions.domain.model.ProjectSummary;
import com.flamingo.ai.sessions.domain.model.SessionSummary;
import com.flamingo.ai.sessions.exception.CorpusNotFoundException;
import com.flamingo.ai.sessions.exception.ProjectNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("TranscriptCatalogServiceImpl Tests")
class TranscriptCatalogServiceImplTest {

  @TempDir Path root;

  private TranscriptCatalogService catalogService;
  private Path older;
  private Path newer;

  @BeforeEach
  void setUp() throws IOException {
    catalogService =
        new TranscriptCatalogServiceImpl(TranscriptFixtures.reader(), new SearchConfig());
    Path project = root.resolve("my-app");
    older =
        TranscriptFixtures.transcript(
            project,
            "older.jsonl",
            TranscriptFixtures.user("u-1", "2024-05-01T10:00:00Z", "first question"),
            "garbage",
            TranscriptFixtures.assistant("a-1", "2024-05-01T10:05:00Z", "an answer"));
    newer =
        TranscriptFixtures.transcript(
            project,
            "newer.jsonl",
            TranscriptFixtures.user("u-2", "2024-06-01T10:00:00Z", "another question"));
    Files.setLastModifiedTime(older, FileTime.from(Instant.parse("2024-05-01T10:05:00Z")));
    Files.setLastModifiedTime(newer, FileTime.from(Instant.parse("2024-06-01T10:00:00Z")));
    TranscriptFixtures.transcript(root.resolve("empty-project"), "readme.txt", "nothing");
    TranscriptFixtures.transcript(root.resolve("markdown"), "older.jsonl", "copy");
  }

  @Test
  @DisplayName("should list projects by name without output directories")
  void shouldListProjects() throws IOException {
    List<ProjectSummary> projects = catalogService.listProjects(root);

    assertThat(projects)
        .extracting(ProjectSummary::name)
        .containsExactly("empty-project", "my-app");
    ProjectSummary myApp = projects.get(1);
    assertThat(myApp.sessionCount()).isEqualTo(2);
    assertThat(myApp.totalSizeBytes()).isEqualTo(Files.size(older) + Files.size(newer));
    assertThat(projects.get(0).sessionCount()).isZero();
  }

  @Test
  @DisplayName("should summarize sessions, most recently modified first")
  void shouldListSessions() throws IOException {
    List<SessionSummary> sessions = catalogService.listSessions(root, "my-app");

    assertThat(sessions)
        .extracting(SessionSummary::getSessionId)
        .containsExactly("newer", "older");
    SessionSummary summary = sessions.get(1);
    assertThat(summary.getProject()).isEqualTo("my-app");
    assertThat(summary.getMessageCount()).isEqualTo(2);
    assertThat(summary.getSpeakers()).containsExactlyInAnyOrder(Speaker.HUMAN, Speaker.ASSISTANT);
    assertThat(summary.getFirstMessageAt()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    assertThat(summary.getLastMessageAt()).isEqualTo(Instant.parse("2024-05-01T10:05:00Z"));
    assertThat(summary.getMalformedEntries()).isEqualTo(1);
    assertThat(summary.getSizeBytes()).isEqualTo(Files.size(older));
  }

  @Test
  @DisplayName("should reject unknown projects and path tricks")
  void shouldRejectUnknownProjects() {
    assertThatThrownBy(() -> catalogService.listSessions(root, "missing"))
        .isInstanceOf(ProjectNotFoundException.class);
    assertThatThrownBy(() -> catalogService.listSessions(root, ".."))
        .isInstanceOf(ProjectNotFoundException.class);
    assertThatThrownBy(() -> catalogService.listSessions(root, "markdown"))
        .isInstanceOf(ProjectNotFoundException.class);
  }

  @Test
  @DisplayName("should fail for a missing corpus root")
  void shouldFailForMissingRoot() {
    assertThatThrownBy(() -> catalogService.listProjects(root.resolve("nope")))
        .isInstanceOf(CorpusNotFoundException.class);
  }
}
