package com.flamingo.ai.agenticrag.service.rag.chunking;

import com.flamingo.ai.agenticrag.exception.InvalidChunkingConfigException;

/**
 * Parameters of the chunk splitter, validated at construction.
 *
 * @param chunkSize target chunk length in characters
 * @param chunkOverlap characters of trailing context repeated at the start of the next chunk;
 *     strictly less than {@code chunkSize}
 * @param minChunkSize chunks shorter than this are merged into a neighbour
 * @param maxChunkSize hard cap; longer chunks are re-split
 * @param useSemanticSplitting selects the semantic strategy instead of the structural one
 */
public record ChunkingConfig(
    int chunkSize,
    int chunkOverlap,
    int minChunkSize,
    int maxChunkSize,
    boolean useSemanticSplitting) {

  public static final int DEFAULT_CHUNK_SIZE = 1000;
  public static final int DEFAULT_CHUNK_OVERLAP = 200;
  public static final int DEFAULT_MIN_CHUNK_SIZE = 100;
  public static final int DEFAULT_MAX_CHUNK_SIZE = 2000;

  public ChunkingConfig {
    if (chunkSize <= 0) {
      throw new InvalidChunkingConfigException("Chunk size must be positive");
    }
    if (chunkOverlap < 0) {
      throw new InvalidChunkingConfigException("Chunk overlap must not be negative");
    }
    if (chunkOverlap >= chunkSize) {
      throw new InvalidChunkingConfigException("Chunk overlap must be less than chunk size");
    }
    if (minChunkSize <= 0) {
      throw new InvalidChunkingConfigException("Minimum chunk size must be positive");
    }
    if (maxChunkSize <= 0) {
      throw new InvalidChunkingConfigException("Maximum chunk size must be positive");
    }
  }

  public static ChunkingConfig defaults() {
    return new ChunkingConfig(
        DEFAULT_CHUNK_SIZE,
        DEFAULT_CHUNK_OVERLAP,
        DEFAULT_MIN_CHUNK_SIZE,
        DEFAULT_MAX_CHUNK_SIZE,
        true);
  }

  /** Structural splitting with the given size and overlap and default bounds. */
  public static ChunkingConfig structural(int chunkSize, int chunkOverlap) {
    return new ChunkingConfig(
        chunkSize, chunkOverlap, DEFAULT_MIN_CHUNK_SIZE, DEFAULT_MAX_CHUNK_SIZE, false);
  }

  public ChunkingConfig withSemanticSplitting(boolean semantic) {
    return new ChunkingConfig(chunkSize, chunkOverlap, minChunkSize, maxChunkSize, semantic);
  }

  public SplitMethod splitMethod() {
    return useSemanticSplitting ? SplitMethod.SEMANTIC : SplitMethod.STRUCTURAL;
  }
}
