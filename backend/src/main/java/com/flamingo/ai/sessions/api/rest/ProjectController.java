package com.flamingo.ai.sessions.api.rest;

import com.flamingo.ai.sessions.api.dto.response.ProjectResponse;
import com.flamingo.ai.sessions.api.dto.response.SessionSummaryResponse;
import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.service.catalog.TranscriptCatalogService;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for browsing the projects and sessions of the corpus. */
@RestController
@RequestMapping("/api/projects")
@RequiredArgsConstructor
public class ProjectController {

  private final TranscriptCatalogService catalogService;
  private final SearchConfig searchConfig;

  /** Lists the project directories. */
  @GetMapping
  public ResponseEntity<List<ProjectResponse>> getProjects() {
    List<ProjectResponse> projects =
        catalogService.listProjects(corpusRoot()).stream()
            .map(ProjectResponse::fromSummary)
            .toList();
    return ResponseEntity.ok(projects);
  }

  /** Lists the sessions of one project, most recently modified first. */
  @GetMapping("/{project}/sessions")
  public ResponseEntity<List<SessionSummaryResponse>> getSessions(@PathVariable String project) {
    List<SessionSummaryResponse> sessions =
        catalogService.listSessions(corpusRoot(), project).stream()
            .map(SessionSummaryResponse::fromSummary)
            .toList();
    return ResponseEntity.ok(sessions);
  }

  private Path corpusRoot() {
    return Paths.get(searchConfig.getCorpus().getRoot());
  }
}
