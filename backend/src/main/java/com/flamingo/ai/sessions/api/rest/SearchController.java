package com.flamingo.ai.sessions.api.rest;

import com.flamingo.ai.sessions.api.dto.request.SearchRequest;
import com.flamingo.ai.sessions.api.dto.response.SearchResponse;
import com.flamingo.ai.sessions.config.SearchConfig;
import com.flamingo.ai.sessions.domain.enums.SearchMode;
import com.flamingo.ai.sessions.domain.enums.Speaker;
import com.flamingo.ai.sessions.domain.model.SearchOutcome;
import com.flamingo.ai.sessions.service.search.ConversationSearchService;
import jakarta.validation.Valid;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for searching the configured transcript corpus. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final ConversationSearchService searchService;
  private final SearchConfig searchConfig;

  /** Runs a search described by a JSON body. */
  @PostMapping
  public ResponseEntity<SearchResponse> search(@Valid @RequestBody SearchRequest request) {
    return ResponseEntity.ok(run(request));
  }

  /** Runs a search described by query parameters, e.g. {@code ?q=login+bug&mode=exact}. */
  @GetMapping
  public ResponseEntity<SearchResponse> searchByParameters(
      @RequestParam(name = "q", required = false) String text,
      @RequestParam(required = false) SearchMode mode,
      @RequestParam(defaultValue = "false") boolean caseSensitive,
      @RequestParam(required = false) Speaker speaker,
      @RequestParam(required = false) Integer contextSize,
      @RequestParam(required = false) Integer maxResults,
      @RequestParam(required = false) Instant dateFrom,
      @RequestParam(required = false) Instant dateTo) {
    SearchRequest request =
        SearchRequest.builder()
            .text(text)
            .mode(mode)
            .caseSensitive(caseSensitive)
            .speaker(speaker)
            .contextSize(contextSize)
            .maxResults(maxResults)
            .dateFrom(dateFrom)
            .dateTo(dateTo)
            .build();
    return ResponseEntity.ok(run(request));
  }

  private SearchResponse run(SearchRequest request) {
    SearchOutcome outcome = searchService.search(request.toQuery(searchConfig.getDefaults()));
    return SearchResponse.fromOutcome(outcome);
  }
}
