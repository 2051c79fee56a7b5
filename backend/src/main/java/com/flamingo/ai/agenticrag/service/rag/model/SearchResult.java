package com.flamingo.ai.agenticrag.service.rag.model;

import java.util.Map;
import java.util.UUID;

/**
 * One ranked chunk returned by retrieval.
 *
 * @param chunkId chunk identity
 * @param documentId owning document
 * @param content chunk text
 * @param score relevance in {@code [0.0, 1.0]}
 * @param metadata chunk metadata
 * @param documentTitle title of the owning document
 * @param documentSource source of the owning document
 */
public record SearchResult(
    UUID chunkId,
    UUID documentId,
    String content,
    double score,
    Map<String, Object> metadata,
    String documentTitle,
    String documentSource) {}
