package com.flamingo.ai.agenticrag.exception;

/** Exception thrown when the embedding backend fails for any text of a call. */
public class EmbeddingException extends RuntimeException {

  private final String model;
  private final String userMessage;

  public EmbeddingException(String model, String message) {
    super(message);
    this.model = model;
    this.userMessage = "Embedding service is temporarily unavailable. Please try again.";
  }

  public EmbeddingException(String model, String message, Throwable cause) {
    super(message, cause);
    this.model = model;
    this.userMessage = "Embedding service is temporarily unavailable. Please try again.";
  }

  public String getModel() {
    return model;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
