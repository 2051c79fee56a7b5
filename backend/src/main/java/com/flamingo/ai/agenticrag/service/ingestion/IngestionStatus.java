package com.flamingo.ai.agenticrag.service.ingestion;

/** Outcome of ingesting one document. */
public enum IngestionStatus {
  SUCCEEDED,
  /** The document produced no chunks and was not stored. */
  SKIPPED,
  FAILED
}
