package com.flamingo.ai.agenticrag.config;

import com.flamingo.ai.agenticrag.service.rag.embedding.EmbeddingModelProvider;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j models. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  /**
   * Embedding clients keyed by model name. The API key is checked when the first client is built,
   * so the service starts without a key and fails on the first embedding call instead.
   */
  @Bean(destroyMethod = "close")
  public EmbeddingModelProvider embeddingModelProvider(RagConfig ragConfig) {
    RagConfig.Embedding embedding = ragConfig.getEmbedding();
    return new EmbeddingModelProvider(
        embeddingModelName,
        modelName -> {
          validateApiKey();
          return OpenAiEmbeddingModel.builder()
              .apiKey(openAiApiKey)
              .modelName(modelName)
              .dimensions(embedding.getDimensions())
              .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
              .logRequests(false)
              .logResponses(false)
              .build();
        });
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
