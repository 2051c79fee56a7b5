package com.flamingo.ai.agenticrag.service.rag.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.agenticrag.config.RagConfig;
import com.flamingo.ai.agenticrag.domain.converter.VectorConverter;
import com.flamingo.ai.agenticrag.domain.repository.ChunkRepository;
import com.flamingo.ai.agenticrag.domain.repository.ChunkSearchRow;
import com.flamingo.ai.agenticrag.exception.SearchException;
import com.flamingo.ai.agenticrag.service.rag.model.SearchResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.PersistenceException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Vector, lexical and hybrid search over the stored chunks.
 *
 * <p>Hybrid search takes the union of the vector and lexical candidates, scores every candidate on
 * both signals and ranks by {@code (1 - textWeight) * vector + textWeight * lexical}. Scores are
 * clamped to {@code [0, 1]}; ties fall back to the unclamped score and then to insertion order.
 *
 * <p>Backend failures always raise {@link SearchException}; this class never hides them behind an
 * empty result.
 */
@Service
@Slf4j
public class RetrievalEngine {

  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final ChunkRepository chunkRepository;
  private final RagConfig ragConfig;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate readOnlyTransaction;

  public RetrievalEngine(
      ChunkRepository chunkRepository,
      RagConfig ragConfig,
      ObjectMapper objectMapper,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.chunkRepository = chunkRepository;
    this.ragConfig = ragConfig;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
    this.readOnlyTransaction = new TransactionTemplate(transactionManager);
    this.readOnlyTransaction.setReadOnly(true);
  }

  /**
   * Nearest chunks by cosine similarity.
   *
   * @param queryEmbedding query vector with the stored dimensionality
   * @param limit maximum number of results, positive
   * @return results ordered by similarity, score {@code 1 - cosine distance}
   */
  @Timed(value = "rag.search.vector", description = "Time for vector search")
  public List<SearchResult> vectorSearch(List<Float> queryEmbedding, int limit) {
    validateEmbedding(queryEmbedding);
    validateLimit(limit);
    List<ChunkSearchRow> rows =
        execute(
            "vector",
            () -> chunkRepository.vectorSearch(VectorConverter.toLiteral(queryEmbedding), limit));
    meterRegistry.counter("rag.search.success", "type", "vector").increment();
    return rows.stream().map(row -> toResult(row, Scores.clamp(row.getVectorScore()))).toList();
  }

  /**
   * Full-text search with English stemming.
   *
   * @param queryText query in plain words
   * @param limit maximum number of results, positive
   * @return matching results ordered by rank, empty for a blank query
   */
  @Timed(value = "rag.search.lexical", description = "Time for lexical search")
  public List<SearchResult> lexicalSearch(String queryText, int limit) {
    validateLimit(limit);
    if (queryText == null || queryText.isBlank()) {
      return List.of();
    }
    List<ChunkSearchRow> rows =
        execute("lexical", () -> chunkRepository.lexicalSearch(queryText, limit));
    meterRegistry.counter("rag.search.success", "type", "lexical").increment();
    return rows.stream().map(row -> toResult(row, Scores.clamp(row.getLexicalScore()))).toList();
  }

  /**
   * Weighted fusion of vector and lexical relevance.
   *
   * <p>A weight of 0 ranks exactly like {@link #vectorSearch}, a weight of 1 exactly like {@link
   * #lexicalSearch}.
   *
   * @param queryEmbedding query vector
   * @param queryText query in plain words
   * @param limit maximum number of results, positive
   * @param textWeight share of the lexical score, in {@code [0, 1]}
   * @return results ordered by combined score
   */
  @Timed(value = "rag.search.hybrid", description = "Time for hybrid search")
  public List<SearchResult> hybridSearch(
      List<Float> queryEmbedding, String queryText, int limit, double textWeight) {
    if (Double.isNaN(textWeight) || textWeight < 0.0 || textWeight > 1.0) {
      throw new IllegalArgumentException("Text weight must be in [0, 1]: " + textWeight);
    }
    validateEmbedding(queryEmbedding);
    validateLimit(limit);

    int candidates = limit * Math.max(1, ragConfig.getRetrieval().getCandidatesMultiplier());
    String embedding = VectorConverter.toLiteral(queryEmbedding);
    String text = queryText == null ? "" : queryText;

    Set<UUID> ids = new LinkedHashSet<>();
    List<ChunkSearchRow> rows =
        execute(
            "hybrid",
            () -> {
              chunkRepository
                  .vectorSearch(embedding, candidates)
                  .forEach(row -> ids.add(row.getChunkId()));
              if (!text.isBlank()) {
                chunkRepository
                    .lexicalSearch(text, candidates)
                    .forEach(row -> ids.add(row.getChunkId()));
              }
              if (ids.isEmpty()) {
                return List.<ChunkSearchRow>of();
              }
              return chunkRepository.scoreCandidates(ids, embedding, text);
            });
    if (rows.isEmpty()) {
      return List.of();
    }

    List<ScoredRow> scored = new ArrayList<>(rows.size());
    for (ChunkSearchRow row : rows) {
      if (!eligible(row, textWeight)) {
        continue;
      }
      double vector = Scores.orZero(row.getVectorScore());
      double lexical = Scores.orZero(row.getLexicalScore());
      double raw = (1.0 - textWeight) * vector + textWeight * lexical;
      double combined =
          Scores.clamp(
              (1.0 - textWeight) * Scores.clamp(vector) + textWeight * Scores.clamp(lexical));
      scored.add(new ScoredRow(row, combined, raw));
    }

    List<SearchResult> results =
        scored.stream()
            .sorted(
                Comparator.comparingDouble(ScoredRow::combined)
                    .reversed()
                    .thenComparing(Comparator.comparingDouble(ScoredRow::raw).reversed())
                    .thenComparingLong(ScoredRow::seq))
            .limit(limit)
            .map(s -> toResult(s.row(), s.combined()))
            .toList();

    meterRegistry.counter("rag.search.success", "type", "hybrid").increment();
    log.debug(
        "Hybrid search over {} candidates returned {} results (textWeight={})",
        ids.size(),
        results.size(),
        textWeight);
    return results;
  }

  /** Only signals with a non-zero weight can make a chunk a result. */
  private static boolean eligible(ChunkSearchRow row, double textWeight) {
    boolean vectorMatch = row.getVectorScore() != null;
    boolean lexicalMatch = Scores.orZero(row.getLexicalScore()) > 0.0;
    return (textWeight < 1.0 && vectorMatch) || (textWeight > 0.0 && lexicalMatch);
  }

  /**
   * Runs the queries of one search in a single read-only transaction. Failures to obtain a
   * connection surface here as well, since the transaction takes its connection on begin.
   */
  private <T> T execute(String type, Supplier<T> queries) {
    try {
      return readOnlyTransaction.execute(status -> queries.get());
    } catch (DataAccessException | TransactionException | PersistenceException e) {
      boolean timedOut = isTimeout(e);
      meterRegistry.counter("rag.search.failure", "type", type).increment();
      log.error("{} search failed (timedOut={}): {}", type, timedOut, e.getMessage(), e);
      throw new SearchException(type + " search failed: " + e.getMessage(), e, timedOut);
    }
  }

  private static boolean isTimeout(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof QueryTimeoutException
          || t instanceof jakarta.persistence.QueryTimeoutException
          || t instanceof SQLTimeoutException
          || t instanceof SQLTransientConnectionException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }

  private SearchResult toResult(ChunkSearchRow row, double score) {
    return new SearchResult(
        row.getChunkId(),
        row.getDocumentId(),
        row.getContent(),
        score,
        parseMetadata(row.getChunkId(), row.getMetadata()),
        row.getDocumentTitle(),
        row.getDocumentSource());
  }

  private Map<String, Object> parseMetadata(UUID chunkId, String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, METADATA_TYPE);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable metadata on chunk {}: {}", chunkId, e.getMessage());
      return Map.of();
    }
  }

  private static void validateLimit(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Limit must be positive: " + limit);
    }
  }

  private static void validateEmbedding(List<Float> queryEmbedding) {
    if (queryEmbedding == null || queryEmbedding.isEmpty()) {
      throw new IllegalArgumentException("Query embedding must not be empty");
    }
  }

  private record ScoredRow(ChunkSearchRow row, double combined, double raw) {
    long seq() {
      return row.getSeq() == null ? Long.MAX_VALUE : row.getSeq();
    }
  }
}
