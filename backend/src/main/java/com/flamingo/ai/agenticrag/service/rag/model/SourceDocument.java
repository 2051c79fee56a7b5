package com.flamingo.ai.agenticrag.service.rag.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A document ready for ingestion: extracted text plus its identity and metadata.
 *
 * @param title display title
 * @param source identifier unique within the corpus, typically a file path
 * @param content Markdown-like plain text
 * @param metadata extraction metadata, e.g. page counts
 */
public record SourceDocument(
    String title, String source, String content, Map<String, Object> metadata) {

  public SourceDocument {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(content, "content");
    title = title == null || title.isBlank() ? source : title;
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
