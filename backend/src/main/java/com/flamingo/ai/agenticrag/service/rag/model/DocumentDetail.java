package com.flamingo.ai.agenticrag.service.rag.model;

import java.util.List;

/** A document together with its chunks in index order. */
public record DocumentDetail(StoredDocument document, List<DocumentChunk> chunks) {}
