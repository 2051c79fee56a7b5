package com.flamingo.ai.agenticrag.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /**
   * Runs one task per document. Shut down with the context, waiting for running documents so
   * their transactions either commit or roll back.
   */
  @Bean(name = "ingestionExecutor")
  public ThreadPoolTaskExecutor ingestionExecutor(RagConfig ragConfig) {
    RagConfig.Ingestion ingestion = ragConfig.getIngestion();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(ingestion.getCorePoolSize());
    executor.setMaxPoolSize(ingestion.getMaxPoolSize());
    executor.setQueueCapacity(ingestion.getQueueCapacity());
    executor.setThreadNamePrefix("ingest-");
    // a full queue slows the submitting thread instead of failing the document
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
