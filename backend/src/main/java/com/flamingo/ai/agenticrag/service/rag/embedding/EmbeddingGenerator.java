package com.flamingo.ai.agenticrag.service.rag.embedding;

import com.flamingo.ai.agenticrag.config.RagConfig;
import com.flamingo.ai.agenticrag.exception.EmbeddingException;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentChunk;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Generates embeddings through batched backend calls.
 *
 * <p>Texts are sent in as few calls as the batch size allows and come back in input order. If any
 * call of a request fails, the whole request fails with {@link EmbeddingException}; callers never
 * see a partially embedded list. All backend calls of the process share one concurrency cap.
 */
@Service
@Slf4j
public class EmbeddingGenerator {

  public static final String EMBEDDING_MODEL_KEY = "embedding_model";
  public static final String EMBEDDING_GENERATED_AT_KEY = "embedding_generated_at";

  private final EmbeddingModelProvider modelProvider;
  private final MeterRegistry meterRegistry;
  private final int batchSize;
  private final int maxCharsPerText;
  private final Semaphore permits;
  private final Clock clock;

  @Autowired
  public EmbeddingGenerator(
      EmbeddingModelProvider modelProvider, RagConfig ragConfig, MeterRegistry meterRegistry) {
    this(
        modelProvider,
        meterRegistry,
        ragConfig.getEmbedding().getBatchSize(),
        ragConfig.getEmbedding().getMaxCharsPerText(),
        ragConfig.getEmbedding().getMaxConcurrentRequests(),
        Clock.systemUTC());
  }

  @VisibleForTesting
  EmbeddingGenerator(
      EmbeddingModelProvider modelProvider,
      MeterRegistry meterRegistry,
      int batchSize,
      int maxCharsPerText,
      int maxConcurrentRequests,
      Clock clock) {
    if (batchSize <= 0 || maxCharsPerText <= 0 || maxConcurrentRequests <= 0) {
      throw new IllegalArgumentException(
          "Embedding batch size, text limit and concurrency must be positive");
    }
    this.modelProvider = modelProvider;
    this.meterRegistry = meterRegistry;
    this.batchSize = batchSize;
    this.maxCharsPerText = maxCharsPerText;
    this.permits = new Semaphore(maxConcurrentRequests, true);
    this.clock = clock;
  }

  /**
   * Embeds chunks with the default model.
   *
   * @param chunks chunks to embed
   * @return new chunk records in input order, each with its embedding set
   */
  @Timed(value = "embedding.embedChunks", description = "Time to embed document chunks")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedChunksFallback")
  @Retry(name = "embedding")
  public List<DocumentChunk> embed(List<DocumentChunk> chunks) {
    return embedChunks(chunks, modelProvider.getDefaultModelName());
  }

  /**
   * Embeds chunks with the given model.
   *
   * <p>Each returned chunk's metadata gains {@value #EMBEDDING_MODEL_KEY} and {@value
   * #EMBEDDING_GENERATED_AT_KEY}; content and offsets are unchanged.
   *
   * @param chunks chunks to embed
   * @param model embedding model identifier
   * @return new chunk records in input order, each with its embedding set
   * @throws EmbeddingException if any backend call fails
   */
  @Timed(value = "embedding.embedChunks", description = "Time to embed document chunks")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedChunksWithModelFallback")
  @Retry(name = "embedding")
  public List<DocumentChunk> embed(List<DocumentChunk> chunks, String model) {
    return embedChunks(chunks, model);
  }

  /**
   * Embeds raw texts with the default model, in batches.
   *
   * @param texts texts to embed
   * @return vectors in input order
   */
  @Timed(value = "embedding.embedTexts", description = "Time to embed texts")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedTextsFallback")
  @Retry(name = "embedding")
  public List<float[]> embedTexts(List<String> texts) {
    List<float[]> vectors = embedInBatches(texts, modelProvider.getDefaultModelName());
    meterRegistry.counter("embedding.requests.success", "type", "texts").increment();
    return vectors;
  }

  /**
   * Embeds a search query with the default model.
   *
   * @param query non-blank query text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "embedding", fallbackMethod = "embedQueryFallback")
  @Retry(name = "embedding")
  public List<Float> embedQuery(String query) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query text must not be blank");
    }
    String model = modelProvider.getDefaultModelName();
    Embedding embedding =
        callBackend(model, embeddingModel -> embeddingModel.embed(truncate(query)));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(embedding.vector());
  }

  private List<DocumentChunk> embedChunks(List<DocumentChunk> chunks, String model) {
    if (chunks.isEmpty()) {
      return List.of();
    }
    List<String> texts = chunks.stream().map(DocumentChunk::content).toList();
    List<float[]> vectors = embedInBatches(texts, model);

    Map<String, Object> embeddingMetadata =
        Map.of(
            EMBEDDING_MODEL_KEY, model,
            EMBEDDING_GENERATED_AT_KEY, Instant.now(clock).toString());
    List<DocumentChunk> embedded = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      embedded.add(chunks.get(i).withEmbedding(toFloatList(vectors.get(i)), embeddingMetadata));
    }

    meterRegistry.counter("embedding.requests.success", "type", "chunks").increment();
    log.debug("Embedded {} chunks with model {}", chunks.size(), model);
    return embedded;
  }

  private List<float[]> embedInBatches(List<String> texts, String model) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (int from = 0; from < texts.size(); from += batchSize) {
      List<TextSegment> segments =
          texts.subList(from, Math.min(from + batchSize, texts.size())).stream()
              .map(this::truncate)
              .map(TextSegment::from)
              .toList();

      List<Embedding> embeddings =
          callBackend(model, embeddingModel -> embeddingModel.embedAll(segments));
      if (embeddings.size() != segments.size()) {
        throw new EmbeddingException(
            model,
            "Embedding backend returned "
                + embeddings.size()
                + " vectors for "
                + segments.size()
                + " texts");
      }
      for (Embedding embedding : embeddings) {
        vectors.add(embedding.vector());
      }
      log.debug(
          "Embedded batch of {} texts ({}/{})", segments.size(), vectors.size(), texts.size());
    }

    if (!vectors.isEmpty()) {
      int dimensions = vectors.get(0).length;
      for (float[] vector : vectors) {
        if (vector.length != dimensions) {
          throw new EmbeddingException(
              model,
              "Embedding backend returned mixed dimensions: "
                  + dimensions
                  + " and "
                  + vector.length);
        }
      }
    }
    return vectors;
  }

  /** Runs one backend call inside the shared concurrency cap. */
  private <T> T callBackend(String model, Function<EmbeddingModel, Response<T>> call) {
    try {
      permits.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new EmbeddingException(model, "Interrupted while waiting for an embedding slot", e);
    }
    try {
      Response<T> response = call.apply(modelProvider.get(model));
      if (response == null || response.content() == null) {
        throw new EmbeddingException(model, "Embedding backend returned no content");
      }
      return response.content();
    } catch (EmbeddingException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EmbeddingException(model, "Embedding backend call failed: " + e.getMessage(), e);
    } finally {
      permits.release();
    }
  }

  private String truncate(String text) {
    if (text.length() <= maxCharsPerText) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars",
        text.length(),
        maxCharsPerText);
    return text.substring(0, maxCharsPerText);
  }

  /** Converts float array to Float list. */
  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<DocumentChunk> embedChunksFallback(List<DocumentChunk> chunks, Throwable t) {
    return embedChunksWithModelFallback(chunks, modelProvider.getDefaultModelName(), t);
  }

  @SuppressWarnings("unused")
  private List<DocumentChunk> embedChunksWithModelFallback(
      List<DocumentChunk> chunks, String model, Throwable t) {
    log.error("Embedding of {} chunks failed: {}", chunks.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "chunks").increment();
    throw asEmbeddingFailure(t, model);
  }

  @SuppressWarnings("unused")
  private List<float[]> embedTextsFallback(List<String> texts, Throwable t) {
    log.error("Embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "texts").increment();
    throw asEmbeddingFailure(t, modelProvider.getDefaultModelName());
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    throw asEmbeddingFailure(t, modelProvider.getDefaultModelName());
  }

  private RuntimeException asEmbeddingFailure(Throwable t, String model) {
    if (t instanceof EmbeddingException || t instanceof IllegalArgumentException) {
      return (RuntimeException) t;
    }
    return new EmbeddingException(model, "Embedding unavailable: " + t.getMessage(), t);
  }
}
