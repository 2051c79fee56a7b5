package com.flamingo.ai.agenticrag.service.rag.model;

import com.flamingo.ai.agenticrag.domain.entity.Document;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** A persisted document as returned by the store. */
public record StoredDocument(
    UUID id,
    String title,
    String source,
    String content,
    Map<String, Object> metadata,
    LocalDateTime createdAt,
    LocalDateTime updatedAt) {

  /** Creates a StoredDocument from a Document entity. */
  public static StoredDocument fromEntity(Document document) {
    return new StoredDocument(
        document.getId(),
        document.getTitle(),
        document.getSource(),
        document.getContent(),
        document.getMetadata() == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(document.getMetadata())),
        document.getCreatedAt(),
        document.getUpdatedAt());
  }
}
