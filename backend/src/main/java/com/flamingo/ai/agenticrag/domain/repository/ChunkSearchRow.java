package com.flamingo.ai.agenticrag.domain.repository;

import java.util.UUID;

/** Projection of one scored chunk row returned by the native search queries. */
public interface ChunkSearchRow {

  UUID getChunkId();

  UUID getDocumentId();

  String getContent();

  /** Chunk metadata as JSON text. */
  String getMetadata();

  String getDocumentTitle();

  String getDocumentSource();

  /** {@code 1 - cosine distance}; null when the chunk has no embedding. */
  Double getVectorScore();

  /** {@code ts_rank_cd} of the chunk against the query, 0 when it does not match. */
  Double getLexicalScore();

  Long getSeq();
}
