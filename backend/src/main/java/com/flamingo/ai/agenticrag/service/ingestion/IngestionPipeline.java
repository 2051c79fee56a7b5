package com.flamingo.ai.agenticrag.service.ingestion;

import com.flamingo.ai.agenticrag.config.RagConfig;
import com.flamingo.ai.agenticrag.exception.ExtractionException;
import com.flamingo.ai.agenticrag.service.rag.chunking.ChunkingConfig;
import com.flamingo.ai.agenticrag.service.rag.chunking.DocumentChunker;
import com.flamingo.ai.agenticrag.service.rag.embedding.EmbeddingGenerator;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentChunk;
import com.flamingo.ai.agenticrag.service.rag.model.SourceDocument;
import com.flamingo.ai.agenticrag.service.store.DocumentStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs documents through split, embed and store.
 *
 * <p>The stages of one document run strictly in order on one thread. Several documents run in
 * parallel on the ingestion executor, and the embedding generator caps the backend calls they make
 * together. A document that fails at any stage leaves nothing behind in the store.
 */
@Service
@Slf4j
public class IngestionPipeline {

  static final Set<String> SUPPORTED_EXTENSIONS =
      Set.of("md", "markdown", "txt", "pdf", "docx", "html");

  private final DocumentChunker documentChunker;
  private final EmbeddingGenerator embeddingGenerator;
  private final DocumentStore documentStore;
  private final DocumentTextExtractor textExtractor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor ingestionExecutor;

  public IngestionPipeline(
      DocumentChunker documentChunker,
      EmbeddingGenerator embeddingGenerator,
      DocumentStore documentStore,
      DocumentTextExtractor textExtractor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("ingestionExecutor") Executor ingestionExecutor) {
    this.documentChunker = documentChunker;
    this.embeddingGenerator = embeddingGenerator;
    this.documentStore = documentStore;
    this.textExtractor = textExtractor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.ingestionExecutor = ingestionExecutor;
  }

  /** Ingests a document with the configured chunking parameters. */
  public IngestionResult ingest(SourceDocument document) {
    return ingest(document, ragConfig.getChunking().toChunkingConfig());
  }

  /**
   * Splits, embeds and stores one document.
   *
   * @param document the document
   * @param config chunking parameters
   * @return SUCCEEDED with the stored id, or SKIPPED when the text yields no chunks
   * @throws com.flamingo.ai.agenticrag.exception.EmbeddingException if embedding fails
   * @throws com.flamingo.ai.agenticrag.exception.StorageException if the write fails
   * @throws CancellationException if the thread is interrupted between stages
   */
  @Timed(value = "rag.ingestion.document", description = "Time to ingest one document")
  public IngestionResult ingest(SourceDocument document, ChunkingConfig config) {
    long start = System.currentTimeMillis();
    log.info("Ingesting document: {}", document.source());

    List<DocumentChunk> chunks =
        documentChunker.split(
            document.content(),
            config,
            document.title(),
            document.source(),
            document.metadata());
    if (chunks.isEmpty()) {
      log.warn("No chunks produced for {}, skipping", document.source());
      meterRegistry.counter("rag.ingestion.documents", "status", "skipped").increment();
      return IngestionResult.skipped(
          document.title(), document.source(), System.currentTimeMillis() - start);
    }
    ensureNotInterrupted(document, "embedding");

    List<DocumentChunk> embedded = embeddingGenerator.embed(chunks);
    ensureNotInterrupted(document, "storing");

    UUID documentId = documentStore.save(document, embedded);

    long elapsed = System.currentTimeMillis() - start;
    meterRegistry.counter("rag.ingestion.documents", "status", "succeeded").increment();
    log.info(
        "Ingested {} as {}: {} chunks in {} ms",
        document.source(),
        documentId,
        embedded.size(),
        elapsed);
    return IngestionResult.succeeded(
        documentId, document.title(), document.source(), embedded.size(), elapsed);
  }

  /**
   * Ingests a document on the ingestion executor.
   *
   * <p>Cancelling the returned future with {@code mayInterruptIfRunning} interrupts the worker, so
   * the document stops at the next stage boundary and nothing is stored.
   */
  public CompletableFuture<IngestionResult> ingestAsync(SourceDocument document) {
    ChunkingConfig config = ragConfig.getChunking().toChunkingConfig();
    return submit(() -> ingest(document, config));
  }

  /**
   * Ingests every supported file under a folder.
   *
   * <p>Files are processed in parallel. A file that fails is recorded as FAILED and the others
   * carry on.
   *
   * @param folder folder to scan recursively
   * @param clean whether to delete all stored documents first
   * @return one result per file, in sorted path order
   * @throws ExtractionException if the folder cannot be listed
   */
  @Timed(value = "rag.ingestion.folder", description = "Time to ingest a folder")
  public List<IngestionResult> ingestFolder(Path folder, boolean clean) {
    List<Path> files = discover(folder);
    log.info("Found {} documents to ingest in {}", files.size(), folder);

    if (clean) {
      log.info("Cleaning existing documents before ingestion");
      documentStore.deleteAll();
    }

    ChunkingConfig config = ragConfig.getChunking().toChunkingConfig();
    List<CompletableFuture<IngestionResult>> futures =
        files.stream()
            .map(file -> submit(() -> ingestFile(file, config)))
            .toList();
    List<IngestionResult> results = futures.stream().map(CompletableFuture::join).toList();

    logSummary(folder, results);
    return results;
  }

  /**
   * Runs a task on the ingestion executor behind a future whose cancellation interrupts the
   * worker thread. A task cancelled before it starts never runs.
   */
  private <T> CompletableFuture<T> submit(Callable<T> work) {
    CompletableFuture<T> result = new CompletableFuture<>();
    FutureTask<T> task =
        new FutureTask<>(work) {
          @Override
          protected void done() {
            if (isCancelled()) {
              result.cancel(false);
              return;
            }
            try {
              result.complete(get());
            } catch (ExecutionException e) {
              result.completeExceptionally(e.getCause());
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
              result.completeExceptionally(e);
            }
          }
        };
    result.whenComplete(
        (value, error) -> {
          if (result.isCancelled()) {
            task.cancel(true);
          }
        });
    ingestionExecutor.execute(task);
    return result;
  }

  private IngestionResult ingestFile(Path file, ChunkingConfig config) {
    long start = System.currentTimeMillis();
    String title = file.getFileName().toString();
    try {
      SourceDocument document = textExtractor.extract(file);
      title = document.title();
      return ingest(document, config);
    } catch (RuntimeException e) {
      meterRegistry.counter("rag.ingestion.documents", "status", "failed").increment();
      log.error("Failed to ingest {}: {}", file, e.getMessage(), e);
      return IngestionResult.failed(
          title, file.toString(), System.currentTimeMillis() - start, e.getMessage());
    }
  }

  List<Path> discover(Path folder) {
    if (!Files.isDirectory(folder)) {
      throw new ExtractionException(folder, "Documents folder does not exist: " + folder);
    }
    try (Stream<Path> paths = Files.walk(folder)) {
      return paths
          .filter(Files::isRegularFile)
          .filter(p -> SUPPORTED_EXTENSIONS.contains(TikaDocumentTextExtractor.extension(p)))
          .sorted()
          .toList();
    } catch (IOException e) {
      throw new ExtractionException(folder, "Failed to list documents: " + e.getMessage(), e);
    }
  }

  private static void ensureNotInterrupted(SourceDocument document, String stage) {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException(
          "Ingestion of " + document.source() + " cancelled before " + stage);
    }
  }

  private static void logSummary(Path folder, List<IngestionResult> results) {
    long succeeded =
        results.stream().filter(r -> r.status() == IngestionStatus.SUCCEEDED).count();
    long skipped = results.stream().filter(r -> r.status() == IngestionStatus.SKIPPED).count();
    long failed = results.stream().filter(IngestionResult::isFailed).count();
    int chunks = results.stream().mapToInt(IngestionResult::chunksCreated).sum();
    long totalMs = results.stream().mapToLong(IngestionResult::processingTimeMs).sum();

    log.info(
        "Ingestion of {} complete: {} succeeded, {} skipped, {} failed, {} chunks, {} ms total",
        folder,
        succeeded,
        skipped,
        failed,
        chunks,
        totalMs);
    results.stream()
        .filter(IngestionResult::isFailed)
        .forEach(r -> log.warn("  failed: {} ({})", r.source(), r.error()));
  }
}
