package com.flamingo.ai.sessions.service.catalog;

import com.flamingo.ai.sessions.domain.model.ProjectSummary;
import com.flamingo.ai.sessions.domain.model.SessionSummary;
import java.nio.file.Path;
import java.util.List;

/** Read-only listing of the projects and sessions in a transcript corpus. */
public interface TranscriptCatalogService {

  /**
   * Lists the project directories under a corpus root, sorted by name.
   *
   * @throws com.flamingo.ai.sessions.exception.CorpusNotFoundException if the root is missing
   */
  List<ProjectSummary> listProjects(Path root);

  /**
   * Summarizes every transcript of a project, most recently modified first.
   *
   * @throws com.flamingo.ai.sessions.exception.ProjectNotFoundException if the project does not
   *     exist
   */
  List<SessionSummary> listSessions(Path root, String project);
}
