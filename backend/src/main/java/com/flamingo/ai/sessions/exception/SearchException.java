package com.flamingo.ai.sessions.exception;

/** Exception thrown when a search fails for a reason other than the query or the corpus data. */
public class SearchException extends RuntimeException {

  private final String userMessage;

  public SearchException(String message) {
    super(message);
    this.userMessage = "Search failed unexpectedly. Please try again.";
  }

  public SearchException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Search failed unexpectedly. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
