package com.flamingo.ai.sessions;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.sessions.service.catalog.TranscriptCatalogService;
import com.flamingo.ai.sessions.service.search.ConversationSearchService;
import com.flamingo.ai.sessions.service.search.IncrementalSearchService;
import com.flamingo.ai.sessions.service.search.ScoringConfig;
import com.flamingo.ai.sessions.service.semantic.EmbeddingService;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the Spring application context loads with the default configuration, where semantic
 * search has no embedding model.
 */
@SpringBootTest(properties = "search.scoring.relevance-threshold=0.6")
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ConversationSearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(IncrementalSearchService.class)).isNotNull();
    assertThat(applicationContext.getBean(TranscriptCatalogService.class)).isNotNull();
  }

  @Test
  @DisplayName("Semantic search should be unavailable without a configured provider")
  void semanticSearchShouldBeUnavailableByDefault() {
    assertThat(applicationContext.getBeansOfType(EmbeddingModel.class)).isEmpty();
    assertThat(applicationContext.getBean(EmbeddingService.class).isAvailable()).isFalse();
  }

  @Test
  @DisplayName("Scoring configuration should be bound from properties")
  void scoringConfigShouldBeBound() {
    assertThat(applicationContext.getBean(ScoringConfig.class).relevanceThreshold())
        .isEqualTo(0.6);
  }
}
