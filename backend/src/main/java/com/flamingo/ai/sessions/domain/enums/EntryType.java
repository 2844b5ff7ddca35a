package com.flamingo.ai.sessions.domain.enums;

import java.util.Optional;

/** Transcript entry types understood by the parser. Any other {@code type} is ignored. */
public enum EntryType {
  USER("user", Speaker.HUMAN),
  ASSISTANT("assistant", Speaker.ASSISTANT),
  TOOL_USE("tool_use", Speaker.TOOL),
  TOOL_RESULT("tool_result", Speaker.TOOL);

  private final String value;
  private final Speaker speaker;

  EntryType(String value, Speaker speaker) {
    this.value = value;
    this.speaker = speaker;
  }

  public String getValue() {
    return value;
  }

  public Speaker getSpeaker() {
    return speaker;
  }

  /**
   * Looks up the entry type for a raw {@code type} field.
   *
   * @param value the raw value, may be null
   * @return the entry type, or empty for unknown types
   */
  public static Optional<EntryType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (EntryType type : values()) {
      if (type.value.equals(value)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
