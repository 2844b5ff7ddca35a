package com.flamingo.ai.sessions.exception;

/** Exception thrown when a search query is rejected before any file is scanned. */
public class InvalidQueryException extends RuntimeException {

  private final String userMessage;

  public InvalidQueryException(String message) {
    super(message);
    this.userMessage = message;
  }

  public InvalidQueryException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = message;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
