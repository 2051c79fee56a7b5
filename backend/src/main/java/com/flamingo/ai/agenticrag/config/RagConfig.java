package com.flamingo.ai.agenticrag.config;

import com.flamingo.ai.agenticrag.service.rag.chunking.ChunkingConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Ingestion ingestion = new Ingestion();

  @Getter
  @Setter
  public static class Chunking {
    private int size = ChunkingConfig.DEFAULT_CHUNK_SIZE;
    private int overlap = ChunkingConfig.DEFAULT_CHUNK_OVERLAP;
    private int minSize = ChunkingConfig.DEFAULT_MIN_CHUNK_SIZE;
    private int maxSize = ChunkingConfig.DEFAULT_MAX_CHUNK_SIZE;
    private boolean semantic = true;

    /**
     * Percentile of neighbouring-window distances above which the semantic splitter starts a new
     * chunk.
     */
    private double breakpointPercentile = 95.0;

    /** Builds the validated chunking configuration; fails fast on inconsistent values. */
    public ChunkingConfig toChunkingConfig() {
      return new ChunkingConfig(size, overlap, minSize, maxSize, semantic);
    }
  }

  @Getter
  @Setter
  public static class Embedding {
    private int dimensions = 1536;

    /** Maximum number of texts sent to the backend in one call. */
    private int batchSize = 100;

    /** Texts longer than this are truncated for the backend call only. */
    private int maxCharsPerText = 8000;

    /** Shared cap on in-flight backend calls across all ingestion tasks. */
    private int maxConcurrentRequests = 4;

    private int timeoutSeconds = 30;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultLimit = 10;
    private int candidatesMultiplier = 3;
    private double defaultTextWeight = 0.3;
    private int defaultPageSize = 20;
  }

  @Getter
  @Setter
  public static class Ingestion {
    private boolean runOnStartup = false;
    private String documentsFolder = "documents";
    private boolean clean = false;
    private int corePoolSize = 2;
    private int maxPoolSize = 4;
    private int queueCapacity = 100;
  }
}
