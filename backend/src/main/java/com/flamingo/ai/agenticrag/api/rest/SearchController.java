package com.flamingo.ai.agenticrag.api.rest;

import com.flamingo.ai.agenticrag.api.dto.request.SearchRequest;
import com.flamingo.ai.agenticrag.service.rag.embedding.EmbeddingGenerator;
import com.flamingo.ai.agenticrag.service.rag.model.SearchResult;
import com.flamingo.ai.agenticrag.service.rag.retrieval.RetrievalEngine;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for searching the knowledge base.
 *
 * <p>Failures are reported as errors rather than empty results.
 */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

  private final EmbeddingGenerator embeddingGenerator;
  private final RetrievalEngine retrievalEngine;

  /** Searches chunks by vector, lexical or hybrid relevance. */
  @PostMapping
  public ResponseEntity<List<SearchResult>> search(@Valid @RequestBody SearchRequest request) {
    log.debug(
        "Search type={} limit={} textWeight={}",
        request.getSearchType(),
        request.getLimit(),
        request.getTextWeight());

    List<SearchResult> results =
        switch (request.getSearchType()) {
          case VECTOR ->
              retrievalEngine.vectorSearch(
                  embeddingGenerator.embedQuery(request.getQuery()), request.getLimit());
          case LEXICAL -> retrievalEngine.lexicalSearch(request.getQuery(), request.getLimit());
          case HYBRID ->
              retrievalEngine.hybridSearch(
                  embeddingGenerator.embedQuery(request.getQuery()),
                  request.getQuery(),
                  request.getLimit(),
                  request.getTextWeight());
        };
    return ResponseEntity.ok(results);
  }
}
