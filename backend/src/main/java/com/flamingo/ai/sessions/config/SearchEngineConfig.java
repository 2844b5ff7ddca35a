package com.flamingo.ai.sessions.config;

import com.flamingo.ai.sessions.service.search.ScoringConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Freezes the mutable scoring properties into the record the strategies use. */
@Configuration
@Slf4j
public class SearchEngineConfig {

  @Bean
  public ScoringConfig scoringConfig(SearchConfig searchConfig) {
    ScoringConfig scoringConfig = ScoringConfig.from(searchConfig.getScoring());
    log.info("Search scoring: {}", scoringConfig);
    return scoringConfig;
  }
}
