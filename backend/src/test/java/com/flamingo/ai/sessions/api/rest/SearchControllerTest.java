package com.flamingo.ai.sessions.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.config.WebMvcConfig;
import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import com.flamingo.ai.sessions.domain.model.SearchOutcome;
import com.flamingo.ai.sessions.domain.model.SearchQuery;
import com.flamingo.ai.sessions.domain.model.SearchResult;
import com.flamingo.ai.sessions.exception.GlobalExceptionHandler;
import com.flamingo.ai.sessions.exception.InvalidQueryException;
import com.flamingo.ai.sessions.service.search.ConversationSearchService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.format.support.DefaultFormattingConversionService;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchController Tests")
class SearchControllerTest {

  @Mock private ConversationSearchService searchService;

  private MockMvc mockMvc;

  private static final SearchResult HIT =
      new SearchResult(
          "session-1",
          "u-1",
          Speaker.HUMAN,
          Instant.parse("2024-05-01T10:00:00Z"),
          1.7,
          "authentication bug",
          "There is an authentication bug in the login flow");

  @BeforeEach
  void setUp() {
    DefaultFormattingConversionService conversionService = new DefaultFormattingConversionService();
    new WebMvcConfig().addFormatters(conversionService);
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SearchController(searchService, new SearchConfig()))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .setConversionService(conversionService)
            .build();
  }

  @Test
  @DisplayName("should search with a JSON body and return ranked hits")
  void shouldSearchWithBody() throws Exception {
    when(searchService.search(any(SearchQuery.class)))
        .thenReturn(new SearchOutcome(List.of(HIT), false, 3, 0, 1, false));

    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"authentication bug\",\"mode\":\"smart\",\"maxResults\":5}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.results[0].sessionId").value("session-1"))
        .andExpect(jsonPath("$.results[0].messageId").value("u-1"))
        .andExpect(jsonPath("$.results[0].speaker").value("human"))
        .andExpect(jsonPath("$.results[0].matchedText").value("authentication bug"))
        .andExpect(jsonPath("$.filesScanned").value(3))
        .andExpect(jsonPath("$.malformedEntries").value(1))
        .andExpect(jsonPath("$.semanticDowngraded").value(false));

    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(searchService).search(captor.capture());
    assertThat(captor.getValue().getMaxResults()).isEqualTo(5);
    assertThat(captor.getValue().getContextSize()).isEqualTo(150);
  }

  @Test
  @DisplayName("should bind lower-case query parameters")
  void shouldSearchWithParameters() throws Exception {
    when(searchService.search(any(SearchQuery.class)))
        .thenReturn(new SearchOutcome(List.of(), true, 1, 0, 0, false));

    mockMvc
        .perform(
            get("/api/search")
                .param("q", "login")
                .param("mode", "semantic")
                .param("speaker", "assistant")
                .param("dateFrom", "2024-05-01T00:00:00Z"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.semanticDowngraded").value(true))
        .andExpect(jsonPath("$.results").isEmpty());

    ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
    verify(searchService).search(captor.capture());
    SearchQuery query = captor.getValue();
    assertThat(query.getMode()).isEqualTo(SearchMode.SEMANTIC);
    assertThat(query.getSpeakerFilter())
        .isEqualTo(Speaker.ASSISTANT);
    assertThat(query.getDateFrom())
        .isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
  }

  @Test
  @DisplayName("should answer invalid queries with 400 and the query error code")
  void shouldRejectInvalidQuery() throws Exception {
    when(searchService.search(any(SearchQuery.class)))
        .thenThrow(new InvalidQueryException("Search text must not be empty"));

    mockMvc
        .perform(get("/api/search").param("q", ""))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("QUERY_001"))
        .andExpect(jsonPath("$.message").value("Search text must not be empty"))
        .andExpect(jsonPath("$.path").value("/api/search"));
  }

  @Test
  @DisplayName("should reject an unknown mode before searching")
  void shouldRejectUnknownMode() throws Exception {
    mockMvc
        .perform(get("/api/search").param("q", "login").param("mode", "fuzzy"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(searchService, never()).search(any(SearchQuery.class));
  }

  @Test
  @DisplayName("should validate the request body")
  void shouldValidateBody() throws Exception {
    mockMvc
        .perform(
            post("/api/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"login\",\"maxResults\":5000}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }
}
