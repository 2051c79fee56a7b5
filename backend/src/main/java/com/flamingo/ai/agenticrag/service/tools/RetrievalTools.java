package com.flamingo.ai.agenticrag.service.tools;

import com.flamingo.ai.agenticrag.config.RagConfig;
import com.flamingo.ai.agenticrag.service.rag.embedding.EmbeddingGenerator;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentDetail;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentSummary;
import com.flamingo.ai.agenticrag.service.rag.model.SearchResult;
import com.flamingo.ai.agenticrag.service.rag.retrieval.RetrievalEngine;
import com.flamingo.ai.agenticrag.service.store.DocumentStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Caller-facing retrieval operations.
 *
 * <p>Unlike {@link RetrievalEngine}, these never throw: a failure is logged, counted under {@code
 * rag.tools.failures} and turned into an empty result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalTools {

  private final EmbeddingGenerator embeddingGenerator;
  private final RetrievalEngine retrievalEngine;
  private final DocumentStore documentStore;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public List<SearchResult> vectorSearch(String query) {
    return vectorSearch(query, ragConfig.getRetrieval().getDefaultLimit());
  }

  /** Finds chunks semantically similar to the query. */
  public List<SearchResult> vectorSearch(String query, int limit) {
    try {
      List<Float> embedding = embeddingGenerator.embedQuery(query);
      return retrievalEngine.vectorSearch(embedding, limit);
    } catch (RuntimeException e) {
      return failed("vector_search", e);
    }
  }

  public List<SearchResult> lexicalSearch(String query) {
    return lexicalSearch(query, ragConfig.getRetrieval().getDefaultLimit());
  }

  /** Finds chunks containing the query terms. */
  public List<SearchResult> lexicalSearch(String query, int limit) {
    try {
      return retrievalEngine.lexicalSearch(query, limit);
    } catch (RuntimeException e) {
      return failed("lexical_search", e);
    }
  }

  public List<SearchResult> hybridSearch(String query) {
    return hybridSearch(
        query,
        ragConfig.getRetrieval().getDefaultLimit(),
        ragConfig.getRetrieval().getDefaultTextWeight());
  }

  /**
   * Combines semantic and keyword relevance.
   *
   * @param query search text
   * @param limit maximum number of results
   * @param textWeight share of keyword relevance, 0 for purely semantic, 1 for purely keyword
   * @return ranked results, empty on any failure
   */
  public List<SearchResult> hybridSearch(String query, int limit, double textWeight) {
    try {
      List<Float> embedding = embeddingGenerator.embedQuery(query);
      return retrievalEngine.hybridSearch(embedding, query, limit, textWeight);
    } catch (RuntimeException e) {
      return failed("hybrid_search", e);
    }
  }

  /** Gets a document with its chunks in order, empty when unknown or on failure. */
  public Optional<DocumentDetail> getDocument(UUID documentId) {
    try {
      return documentStore.getWithChunks(documentId);
    } catch (RuntimeException e) {
      countFailure("get_document", e);
      return Optional.empty();
    }
  }

  public List<DocumentSummary> listDocuments() {
    return listDocuments(ragConfig.getRetrieval().getDefaultPageSize(), 0);
  }

  /** Lists stored documents, newest first. */
  public List<DocumentSummary> listDocuments(int limit, int offset) {
    try {
      return documentStore.list(limit, offset);
    } catch (RuntimeException e) {
      countFailure("list_documents", e);
      return List.of();
    }
  }

  private List<SearchResult> failed(String tool, RuntimeException e) {
    countFailure(tool, e);
    return List.of();
  }

  private void countFailure(String tool, RuntimeException e) {
    meterRegistry.counter("rag.tools.failures", "tool", tool).increment();
    log.error("Tool {} failed: {}", tool, e.getMessage(), e);
  }
}
