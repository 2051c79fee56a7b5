package com.flamingo.ai.agenticrag.service.rag.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the embedding clients of the process, one per model identifier.
 *
 * <p>Clients are built on first use and kept until the application context closes.
 */
@Slf4j
public class EmbeddingModelProvider {

  private final String defaultModelName;
  private final Function<String, EmbeddingModel> factory;
  private final Map<String, EmbeddingModel> models = new ConcurrentHashMap<>();

  public EmbeddingModelProvider(
      String defaultModelName, Function<String, EmbeddingModel> factory) {
    this.defaultModelName = defaultModelName;
    this.factory = factory;
  }

  /**
   * Returns the client for the given model, building it on first use.
   *
   * @param modelName model identifier, e.g. {@code text-embedding-3-small}
   * @return the embedding client
   */
  public EmbeddingModel get(String modelName) {
    return models.computeIfAbsent(
        modelName,
        name -> {
          log.info("Creating embedding client for model {}", name);
          return factory.apply(name);
        });
  }

  public String getDefaultModelName() {
    return defaultModelName;
  }

  /** Drops all clients; called when the application context closes. */
  public void close() {
    log.info("Releasing {} embedding client(s)", models.size());
    models.clear();
  }
}
