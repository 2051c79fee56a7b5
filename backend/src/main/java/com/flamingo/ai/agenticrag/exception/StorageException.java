package com.flamingo.ai.agenticrag.exception;

import java.util.UUID;

/**
 * Exception thrown when a document transaction fails. The transaction has been rolled back, so no
 * row of the document is visible.
 */
public class StorageException extends RuntimeException {

  private final UUID documentId;
  private final String userMessage;

  public StorageException(UUID documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to store document";
  }

  public StorageException(String message, Throwable cause) {
    this(null, message, cause);
  }

  /** Id assigned to the document before the failure, or {@code null} if none was assigned. */
  public UUID getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
