package com.flamingo.ai.sessions.exception;

import java.nio.file.Path;

/** Exception thrown when the transcript root directory does not exist. */
public class CorpusNotFoundException extends RuntimeException {

  private final Path root;

  public CorpusNotFoundException(Path root) {
    super("Transcript directory not found: " + root);
    this.root = root;
  }

  public Path getRoot() {
    return root;
  }
}
