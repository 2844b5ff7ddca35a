package com.flamingo.ai.sessions.exception;

/** Exception thrown when a project directory is not found under the transcript root. */
public class ProjectNotFoundException extends RuntimeException {

  private final String project;

  public ProjectNotFoundException(String project) {
    super("Project not found: " + project);
    this.project = project;
  }

  public String getProject() {
    return project;
  }
}
