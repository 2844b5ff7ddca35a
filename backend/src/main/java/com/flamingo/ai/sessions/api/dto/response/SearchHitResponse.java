package com.flamingo.ai.sessions.api.dto.response;

import com.flamingo.ai.sessions.domain.enums.Speaker;
import com.flamingo.ai.sessions.domain.model.SearchResult;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one search hit. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHitResponse {

  private String sessionId;
  private String messageId;
  private Speaker speaker;
  private Instant timestamp;
  private double score;
  private String matchedText;
  private String snippet;

  public static SearchHitResponse fromResult(SearchResult result) {
    return SearchHitResponse.builder()
        .sessionId(result.sessionId())
        .messageId(result.messageId())
        .speaker(result.speaker())
        .timestamp(result.timestamp())
        .score(result.score())
        .matchedText(result.matchedText())
        .snippet(result.snippet())
        .build();
  }
}
