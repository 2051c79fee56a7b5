package com.flamingo.ai.agenticrag.service.rag.chunking;

import java.util.List;

/**
 * One way of cutting a text into chunk ranges.
 *
 * <p>Implementations return trimmed, non-empty spans in ascending order. Size bounds beyond
 * {@code chunkSize} are enforced afterwards by {@link ChunkPostProcessor}.
 */
public interface ChunkingStrategy {

  /**
   * Splits the content into ordered character ranges.
   *
   * @param content non-blank source text
   * @param config chunking parameters
   * @return ranges into {@code content}
   */
  List<TextSpan> split(String content, ChunkingConfig config);

  /** Which member of the closed strategy set this is. */
  SplitMethod method();
}
