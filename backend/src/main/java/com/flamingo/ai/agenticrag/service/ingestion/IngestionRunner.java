package com.flamingo.ai.agenticrag.service.ingestion;

import com.flamingo.ai.agenticrag.config.RagConfig;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Ingests the documents folder once on startup.
 *
 * <p>Enabled by {@code rag.ingestion.run-on-startup}. Passing {@code --clean} on the command line
 * has the same effect as {@code rag.ingestion.clean=true}.
 */
@Component
@ConditionalOnProperty(prefix = "rag.ingestion", name = "run-on-startup", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class IngestionRunner implements CommandLineRunner {

  static final String CLEAN_ARG = "--clean";

  private final IngestionPipeline ingestionPipeline;
  private final RagConfig ragConfig;

  @Override
  public void run(String... args) {
    Path folder = Path.of(ragConfig.getIngestion().getDocumentsFolder());
    boolean clean = ragConfig.getIngestion().isClean() || Arrays.asList(args).contains(CLEAN_ARG);
    try {
      log.info("Starting startup ingestion of {} (clean={})", folder, clean);
      List<IngestionResult> results = ingestionPipeline.ingestFolder(folder, clean);
      long failed = results.stream().filter(IngestionResult::isFailed).count();
      log.info("Startup ingestion finished: {}/{} documents failed", failed, results.size());
    } catch (RuntimeException e) {
      // Startup continues; the API can still serve what is already stored
      log.error("Startup ingestion of {} failed: {}", folder, e.getMessage(), e);
    }
  }
}
