package com.flamingo.ai.agenticrag.exception;

import java.nio.file.Path;

/** Exception thrown when a source document cannot be read or converted to text. */
public class ExtractionException extends RuntimeException {

  private final Path source;
  private final String userMessage;

  public ExtractionException(Path source, String message) {
    super(message);
    this.source = source;
    this.userMessage = "Failed to read document";
  }

  public ExtractionException(Path source, String message, Throwable cause) {
    super(message, cause);
    this.source = source;
    this.userMessage = "Failed to read document";
  }

  public Path getSource() {
    return source;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
