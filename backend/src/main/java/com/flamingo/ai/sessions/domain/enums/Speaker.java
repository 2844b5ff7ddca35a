package com.flamingo.ai.sessions.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Defines who produced a conversation message. */
public enum Speaker {
  /** Message typed by the user. */
  HUMAN("human"),

  /** Message produced by the assistant. */
  ASSISTANT("assistant"),

  /** Tool invocation or tool output. */
  TOOL("tool");

  private final String value;

  Speaker(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Resolves a speaker from its external name, ignoring case.
   *
   * @param value the external name, e.g. {@code human}
   * @return the matching speaker
   * @throws IllegalArgumentException if the name is unknown
   */
  @JsonCreator
  public static Speaker fromValue(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    for (Speaker speaker : values()) {
      if (speaker.value.equals(normalized)) {
        return speaker;
      }
    }
    throw new IllegalArgumentException("Unknown speaker: " + value);
  }
}
