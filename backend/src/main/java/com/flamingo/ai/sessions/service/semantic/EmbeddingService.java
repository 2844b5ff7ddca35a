package com.flamingo.ai.sessions.service.semantic;

import com.flamingo.ai.sessions.config.SearchConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.store.embedding.CosineSimilarity;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings for semantic search.
 *
 * <p>The embedding model is optional. Without one the service reports itself unavailable and
 * semantic queries are downgraded to smart mode by the caller.
 */
@Service
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final SearchConfig searchConfig;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(
      Optional<EmbeddingModel> embeddingModel,
      SearchConfig searchConfig,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel.orElse(null);
    this.searchConfig = searchConfig;
    this.meterRegistry = meterRegistry;
    log.info("Semantic search {}", isAvailable() ? "available" : "unavailable");
  }

  public boolean isAvailable() {
    return embeddingModel != null;
  }

  /**
   * Embeds a text, truncated to the configured maximum length.
   *
   * @param text the text to embed
   * @return the embedding, or empty when no model is configured or the model failed
   */
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedFallback")
  public Optional<Embedding> embed(String text) {
    if (embeddingModel == null) {
      return Optional.empty();
    }
    int maxChars = searchConfig.getSemantic().getMaxTextChars();
    if (text.length() > maxChars) {
      log.debug("Truncating text from {} to {} chars before embedding", text.length(), maxChars);
      text = text.substring(0, maxChars);
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(text);
      meterRegistry.counter("embedding.requests.success").increment();
      return Optional.ofNullable(response.content());
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /** Cosine similarity of two embeddings, in [-1, 1]. */
  public double similarity(Embedding first, Embedding second) {
    return CosineSimilarity.between(first, second);
  }

  @SuppressWarnings("unused")
  private Optional<Embedding> embedFallback(String text, Throwable t) {
    log.warn("Embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure").increment();
    return Optional.empty();
  }
}
