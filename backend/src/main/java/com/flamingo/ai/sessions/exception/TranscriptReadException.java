package com.flamingo.ai.sessions.exception;

import java.io.IOException;
import java.nio.file.Path;

/** Thrown when a transcript file cannot be opened or read. */
public class TranscriptReadException extends RuntimeException {

  private final Path file;

  public TranscriptReadException(Path file, IOException cause) {
    super("Cannot read transcript " + file + ": " + cause.getMessage(), cause);
    this.file = file;
  }

  public Path getFile() {
    return file;
  }
}
