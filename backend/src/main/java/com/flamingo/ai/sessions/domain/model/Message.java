package com.flamingo.ai.sessions.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.sessions.domain.enums.EntryType;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One normalized conversation event read from a transcript line.
 *
 * <p>Messages are rebuilt from the source file on every read; nothing caches or mutates them.
 */
@Value
@Builder
public class Message {

  /** Source {@code uuid}, or {@code <sessionId>:<lineNumber>} when the entry has none. */
  String id;

  /** Transcript the message belongs to (file name without suffix). */
  String sessionId;

  Speaker speaker;

  EntryType entryType;

  Instant timestamp;

  /** Flattened plain text; empty when the entry carries no text blocks. */
  String text;

  /** Number of non-text content blocks (images, tool calls, thinking). */
  int nonTextBlocks;

  /** 1-based line number within the transcript file. */
  int lineNumber;

  /** Original JSON entry, kept for lossless reconstruction. */
  JsonNode raw;

  public boolean hasText() {
    return text != null && !text.isEmpty();
  }
}
