package com.flamingo.ai.agenticrag.service.rag.chunking;

import com.flamingo.ai.agenticrag.service.rag.model.DocumentChunk;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns document text into ordered, bounded chunks with exact character offsets.
 *
 * <p>The strategy is chosen by {@link ChunkingConfig#useSemanticSplitting()}. Whatever the
 * strategy returns passes through {@link ChunkPostProcessor}, so every chunk respects the size
 * bounds of the configuration.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentChunker {

  public static final String SOURCE_KEY = "source";
  public static final String TITLE_KEY = "title";
  public static final String CHUNK_INDEX_KEY = "chunk_index";
  public static final String TOTAL_CHUNKS_KEY = "total_chunks";
  public static final String CHUNK_METHOD_KEY = "chunk_method";

  private final StructuralChunkingStrategy structuralChunkingStrategy;
  private final SemanticChunkingStrategy semanticChunkingStrategy;
  private final ChunkPostProcessor chunkPostProcessor;

  /**
   * Splits text into chunks without document identity.
   *
   * @param content document text
   * @param config chunking parameters
   * @return chunks with indices {@code 0..n-1}; empty for blank input
   */
  public List<DocumentChunk> split(String content, ChunkingConfig config) {
    return split(content, config, null, null, Map.of());
  }

  /**
   * Splits text into chunks whose metadata is seeded with the document identity.
   *
   * @param content document text
   * @param config chunking parameters
   * @param title document title, may be null
   * @param source document source, may be null
   * @param metadata caller metadata copied into every chunk
   * @return chunks with indices {@code 0..n-1}; empty for blank input
   */
  public List<DocumentChunk> split(
      String content,
      ChunkingConfig config,
      String title,
      String source,
      Map<String, Object> metadata) {
    if (content == null || content.isBlank()) {
      log.debug("Blank content for source {}, no chunks produced", source);
      return List.of();
    }

    SplitMethod method = config.splitMethod();
    List<TextSpan> spans = strategyFor(method).split(content, config);
    spans = chunkPostProcessor.apply(content, spans, config);

    List<DocumentChunk> chunks = new ArrayList<>(spans.size());
    for (int i = 0; i < spans.size(); i++) {
      TextSpan span = spans.get(i);
      Map<String, Object> chunkMetadata = new LinkedHashMap<>();
      if (metadata != null) {
        chunkMetadata.putAll(metadata);
      }
      if (source != null) {
        chunkMetadata.put(SOURCE_KEY, source);
      }
      if (title != null) {
        chunkMetadata.put(TITLE_KEY, title);
      }
      chunkMetadata.put(CHUNK_INDEX_KEY, i);
      chunkMetadata.put(TOTAL_CHUNKS_KEY, spans.size());
      chunkMetadata.put(CHUNK_METHOD_KEY, method.getMetadataValue());

      chunks.add(DocumentChunk.of(i, span.start(), span.end(), span.of(content), chunkMetadata));
    }

    log.debug(
        "Split {} chars from {} into {} chunks using {} strategy",
        content.length(),
        source,
        chunks.size(),
        method.getMetadataValue());
    return chunks;
  }

  private ChunkingStrategy strategyFor(SplitMethod method) {
    return switch (method) {
      case STRUCTURAL -> structuralChunkingStrategy;
      case SEMANTIC -> semanticChunkingStrategy;
    };
  }
}
