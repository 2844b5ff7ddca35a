package com.flamingo.ai.sessions.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Defines the matching strategies available to a search. */
public enum SearchMode {
  /** Token overlap with phrase and proximity bonuses. */
  SMART("smart", "Token overlap, phrase and proximity bonuses"),

  /** Substring containment. */
  EXACT("exact", "Substring containment"),

  /** Regular expression match. */
  REGEX("regex", "Regular expression match"),

  /** Embedding similarity, falls back to smart when no model is available. */
  SEMANTIC("semantic", "Embedding similarity");

  private final String value;
  private final String description;

  SearchMode(String value, String description) {
    this.value = value;
    this.description = description;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Resolves a mode from its external name, ignoring case.
   *
   * @param value the external name, e.g. {@code regex}
   * @return the matching mode
   * @throws IllegalArgumentException if the name is unknown
   */
  @JsonCreator
  public static SearchMode fromValue(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    for (SearchMode mode : values()) {
      if (mode.value.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown search mode: " + value);
  }
}
