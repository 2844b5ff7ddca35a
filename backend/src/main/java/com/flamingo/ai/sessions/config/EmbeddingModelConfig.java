package com.flamingo.ai.sessions.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j embedding model used by semantic search.
 *
 * <p>The model runs in-process and is only created when {@code search.semantic.provider=local}.
 */
@Configuration
@Slf4j
public class EmbeddingModelConfig {

  @Bean
  @ConditionalOnProperty(name = "search.semantic.provider", havingValue = "local")
  public EmbeddingModel embeddingModel() {
    log.info("Loading in-process all-MiniLM-L6-v2 (quantized) embedding model");
    return new AllMiniLmL6V2QuantizedEmbeddingModel();
  }
}
