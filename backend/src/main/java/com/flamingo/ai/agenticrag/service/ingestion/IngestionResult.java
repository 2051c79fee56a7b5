package com.flamingo.ai.agenticrag.service.ingestion;

import java.util.UUID;

/**
 * Result of ingesting one document.
 *
 * @param documentId id of the stored document, null unless it was stored
 * @param title document title
 * @param source document source
 * @param chunksCreated number of chunks stored
 * @param processingTimeMs wall time spent on the document
 * @param status outcome
 * @param error failure message, null unless failed
 */
public record IngestionResult(
    UUID documentId,
    String title,
    String source,
    int chunksCreated,
    long processingTimeMs,
    IngestionStatus status,
    String error) {

  public static IngestionResult succeeded(
      UUID documentId, String title, String source, int chunksCreated, long processingTimeMs) {
    return new IngestionResult(
        documentId,
        title,
        source,
        chunksCreated,
        processingTimeMs,
        IngestionStatus.SUCCEEDED,
        null);
  }

  public static IngestionResult skipped(String title, String source, long processingTimeMs) {
    return new IngestionResult(
        null, title, source, 0, processingTimeMs, IngestionStatus.SKIPPED, null);
  }

  public static IngestionResult failed(
      String title, String source, long processingTimeMs, String error) {
    return new IngestionResult(
        null, title, source, 0, processingTimeMs, IngestionStatus.FAILED, error);
  }

  public boolean isFailed() {
    return status == IngestionStatus.FAILED;
  }
}
