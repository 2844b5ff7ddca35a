package com.flamingo.ai.sessions.domain.model;

import com.flamingo.ai.sessions.domain.enums.Speaker;
import java.time.Instant;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/** Metadata of one transcript, computed by streaming it. */
@Value
@Builder
public class SessionSummary {
  String sessionId;
  String project;
  int messageCount;
  Set<Speaker> speakers;
  Instant firstMessageAt;
  Instant lastMessageAt;
  long sizeBytes;
  Instant modifiedAt;
  long malformedEntries;
}
