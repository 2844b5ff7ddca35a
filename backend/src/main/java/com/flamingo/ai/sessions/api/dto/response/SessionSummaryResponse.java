package com.flamingo.ai.sessions.api.dto.response;

import com.flamingo.ai.sessions.domain.enums.Speaker;
import com.flamingo.ai.sessions.domain.model.SessionSummary;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one transcript of a project. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryResponse {

  private String sessionId;
  private String project;
  private int messageCount;
  private List<Speaker> speakers;
  private Instant firstMessageAt;
  private Instant lastMessageAt;
  private long sizeBytes;
  private Instant modifiedAt;
  private long malformedEntries;

  public static SessionSummaryResponse fromSummary(SessionSummary summary) {
    return SessionSummaryResponse.builder()
        .sessionId(summary.getSessionId())
        .project(summary.getProject())
        .messageCount(summary.getMessageCount())
        .speakers(summary.getSpeakers().stream().sorted().toList())
        .firstMessageAt(summary.getFirstMessageAt())
        .lastMessageAt(summary.getLastMessageAt())
        .sizeBytes(summary.getSizeBytes())
        .modifiedAt(summary.getModifiedAt())
        .malformedEntries(summary.getMalformedEntries())
        .build();
  }
}
