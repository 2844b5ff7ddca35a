package com.flamingo.ai.sessions.service.semantic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.sessions.config.SearchConfig;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;

  private SearchConfig searchConfig;
  private MeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    searchConfig = new SearchConfig();
    meterRegistry = new SimpleMeterRegistry();
  }

  @Test
  @DisplayName("should be unavailable without an embedding model")
  void shouldBeUnavailableWithoutModel() {
    EmbeddingService service = new EmbeddingService(Optional.empty(), searchConfig, meterRegistry);

    assertThat(service.isAvailable()).isFalse();
    assertThat(service.embed("anything")).isEmpty();
  }

  @Test
  @DisplayName("should embed text and count the request")
  void shouldEmbedText() {
    Embedding vector = Embedding.from(new float[] {0.1f, 0.2f, 0.3f});
    when(embeddingModel.embed("login bug")).thenReturn(Response.from(vector));
    EmbeddingService service =
        new EmbeddingService(Optional.of(embeddingModel), searchConfig, meterRegistry);

    assertThat(service.isAvailable()).isTrue();
    assertThat(service.embed("login bug")).contains(vector);
    assertThat(meterRegistry.counter("embedding.requests.success").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("should truncate long text before embedding")
  void shouldTruncateLongText() {
    searchConfig.getSemantic().setMaxTextChars(10);
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {1f})));
    EmbeddingService service =
        new EmbeddingService(Optional.of(embeddingModel), searchConfig, meterRegistry);

    service.embed("x".repeat(25));

    verify(embeddingModel).embed("x".repeat(10));
  }

  @Test
  @DisplayName("should compute cosine similarity")
  void shouldComputeSimilarity() {
    EmbeddingService service = new EmbeddingService(Optional.empty(), searchConfig, meterRegistry);
    Embedding first = Embedding.from(new float[] {1f, 0f});
    Embedding second = Embedding.from(new float[] {1f, 1f});

    assertThat(service.similarity(first, first)).isCloseTo(1.0, within(1e-6));
    assertThat(service.similarity(first, second)).isCloseTo(Math.sqrt(0.5), within(1e-6));
  }
}
