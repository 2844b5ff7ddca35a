package com.flamingo.ai.sessions.api.rest;

import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.service.semantic.EmbeddingService;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final EmbeddingService embeddingService;
  private final SearchConfig searchConfig;

  /** Returns a simple health check response. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> health = new HashMap<>();
    health.put("status", "UP");
    health.put("timestamp", Instant.now());
    health.put("service", "claude-sessions");
    health.put("corpusAvailable", Files.isDirectory(Paths.get(searchConfig.getCorpus().getRoot())));
    health.put("semanticSearchAvailable", embeddingService.isAvailable());
    return ResponseEntity.ok(health);
  }
}
