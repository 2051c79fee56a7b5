package com.flamingo.ai.agenticrag.service.rag.chunking;

/** The closed set of splitting strategies. */
public enum SplitMethod {
  STRUCTURAL("structural"),
  SEMANTIC("semantic");

  private final String metadataValue;

  SplitMethod(String metadataValue) {
    this.metadataValue = metadataValue;
  }

  /** Value recorded under the {@code chunk_method} metadata key. */
  public String getMetadataValue() {
    return metadataValue;
  }
}
