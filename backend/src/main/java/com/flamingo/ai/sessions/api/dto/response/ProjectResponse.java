package com.flamingo.ai.sessions.api.dto.response;

import com.flamingo.ai.sessions.domain.model.ProjectSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a project directory. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectResponse {

  private String name;
  private int sessionCount;
  private long totalSizeBytes;

  public static ProjectResponse fromSummary(ProjectSummary summary) {
    return ProjectResponse.builder()
        .name(summary.name())
        .sessionCount(summary.sessionCount())
        .totalSizeBytes(summary.totalSizeBytes())
        .build();
  }
}
