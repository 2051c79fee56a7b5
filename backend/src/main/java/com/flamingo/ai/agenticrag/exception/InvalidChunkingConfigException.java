package com.flamingo.ai.agenticrag.exception;

/** Exception thrown when chunking parameters are inconsistent. */
public class InvalidChunkingConfigException extends IllegalArgumentException {

  public InvalidChunkingConfigException(String message) {
    super(message);
  }
}
