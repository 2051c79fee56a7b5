package com.flamingo.ai.agenticrag.service.rag.model;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/** Document metadata for listings, without the content. */
public record DocumentSummary(
    UUID id,
    String title,
    String source,
    Map<String, Object> metadata,
    LocalDateTime createdAt,
    LocalDateTime updatedAt,
    long chunkCount) {}
