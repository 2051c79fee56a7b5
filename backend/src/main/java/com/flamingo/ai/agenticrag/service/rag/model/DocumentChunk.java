package com.flamingo.ai.agenticrag.service.rag.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A bounded contiguous slice of a document, the unit of retrieval.
 *
 * <p>{@code content} is exactly {@code documentContent.substring(startChar, endChar)}. Instances
 * are immutable; enrichment returns a new record.
 *
 * <p>{@code tokenCount} defaults to {@code max(1, length / 4)}. This is a rough cost estimate
 * rather than real tokenization and must not be used to enforce size limits.
 *
 * @param index 0-based position within the document, contiguous
 * @param startChar inclusive offset into the document content
 * @param endChar exclusive offset into the document content
 * @param content chunk text
 * @param tokenCount estimated token count
 * @param embedding embedding vector, {@code null} before the embedding stage
 * @param metadata document metadata merged with chunk-specific keys
 */
public record DocumentChunk(
    int index,
    int startChar,
    int endChar,
    String content,
    int tokenCount,
    List<Float> embedding,
    Map<String, Object> metadata) {

  public DocumentChunk {
    Objects.requireNonNull(content, "content");
    if (index < 0) {
      throw new IllegalArgumentException("Chunk index must not be negative: " + index);
    }
    if (startChar < 0 || endChar <= startChar) {
      throw new IllegalArgumentException(
          "Invalid chunk offsets [" + startChar + ", " + endChar + ")");
    }
    if (endChar - startChar != content.length()) {
      throw new IllegalArgumentException(
          "Chunk offsets [" + startChar + ", " + endChar + ") do not match content length "
              + content.length());
    }
    embedding = embedding == null ? null : List.copyOf(embedding);
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Creates an unembedded chunk with an estimated token count. */
  public static DocumentChunk of(
      int index, int startChar, int endChar, String content, Map<String, Object> metadata) {
    return new DocumentChunk(
        index, startChar, endChar, content, estimateTokens(content), null, metadata);
  }

  /** Approximates the token count as {@code max(1, length / 4)}. */
  public static int estimateTokens(String content) {
    return Math.max(1, content.length() / 4);
  }

  /**
   * Returns a copy carrying the embedding and the extra metadata keys. Content and positions are
   * unchanged.
   */
  public DocumentChunk withEmbedding(List<Float> vector, Map<String, Object> extraMetadata) {
    Map<String, Object> merged = new LinkedHashMap<>(metadata);
    merged.putAll(extraMetadata);
    return new DocumentChunk(index, startChar, endChar, content, tokenCount, vector, merged);
  }

  public boolean hasEmbedding() {
    return embedding != null && !embedding.isEmpty();
  }
}
