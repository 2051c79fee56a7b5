package com.flamingo.ai.agenticrag.domain.repository;

import com.flamingo.ai.agenticrag.domain.entity.Chunk;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for Chunk entities.
 *
 * <p>The search queries are native pgvector and full-text SQL. Query embeddings are passed in the
 * pgvector text form and cast on the server.
 */
@Repository
public interface ChunkRepository extends JpaRepository<Chunk, UUID> {

  String ROW_COLUMNS =
      "c.id AS \"chunkId\", c.document_id AS \"documentId\", c.content AS \"content\", "
          + "CAST(c.metadata AS text) AS \"metadata\", d.title AS \"documentTitle\", "
          + "d.source AS \"documentSource\", c.seq AS \"seq\"";

  /** Finds all chunks of a document ordered by index. */
  List<Chunk> findByDocumentIdOrderByChunkIndexAsc(UUID documentId);

  /** Nearest neighbours by cosine distance; ties keep insertion order. */
  @Query(
      value =
          "SELECT "
              + ROW_COLUMNS
              + ", 1 - (c.embedding <=> CAST(:embedding AS vector)) AS \"vectorScore\", "
              + "CAST(0 AS float8) AS \"lexicalScore\" "
              + "FROM chunks c JOIN documents d ON d.id = c.document_id "
              + "WHERE c.embedding IS NOT NULL "
              + "ORDER BY c.embedding <=> CAST(:embedding AS vector), c.seq "
              + "LIMIT :limit",
      nativeQuery = true)
  List<ChunkSearchRow> vectorSearch(
      @Param("embedding") String embedding, @Param("limit") int limit);

  /** Full-text matches ranked by cover density; ties keep insertion order. */
  @Query(
      value =
          "SELECT "
              + ROW_COLUMNS
              + ", CAST(NULL AS float8) AS \"vectorScore\", "
              + "CAST(ts_rank_cd(c.content_tsv, plainto_tsquery('english', :query), 32) "
              + "AS float8) AS \"lexicalScore\" "
              + "FROM chunks c JOIN documents d ON d.id = c.document_id "
              + "WHERE c.content_tsv @@ plainto_tsquery('english', :query) "
              + "ORDER BY \"lexicalScore\" DESC, c.seq "
              + "LIMIT :limit",
      nativeQuery = true)
  List<ChunkSearchRow> lexicalSearch(@Param("query") String query, @Param("limit") int limit);

  /** Computes both scores for the given chunks; non-matching chunks get lexical score 0. */
  @Query(
      value =
          "SELECT "
              + ROW_COLUMNS
              + ", 1 - (c.embedding <=> CAST(:embedding AS vector)) AS \"vectorScore\", "
              + "CASE WHEN c.content_tsv @@ plainto_tsquery('english', :query) "
              + "THEN CAST(ts_rank_cd(c.content_tsv, plainto_tsquery('english', :query), 32) "
              + "AS float8) ELSE CAST(0 AS float8) END AS \"lexicalScore\" "
              + "FROM chunks c JOIN documents d ON d.id = c.document_id "
              + "WHERE c.id IN (:ids)",
      nativeQuery = true)
  List<ChunkSearchRow> scoreCandidates(
      @Param("ids") Collection<UUID> ids,
      @Param("embedding") String embedding,
      @Param("query") String query);
}
