package com.flamingo.ai.agenticrag.service.store;

import com.flamingo.ai.agenticrag.service.rag.model.DocumentChunk;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentDetail;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentSummary;
import com.flamingo.ai.agenticrag.service.rag.model.SourceDocument;
import com.flamingo.ai.agenticrag.service.rag.model.StoredDocument;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Transactional persistence of documents and their embedded chunks. */
public interface DocumentStore {

  /**
   * Stores a document and all of its chunks atomically. A previous document with the same source
   * is replaced in the same transaction.
   *
   * @param document the document to store
   * @param chunks its chunks, normally embedded
   * @return the id of the stored document
   * @throws com.flamingo.ai.agenticrag.exception.StorageException if any write fails; no row of
   *     the document is visible afterwards
   */
  UUID save(SourceDocument document, List<DocumentChunk> chunks);

  /** Gets a document by id, empty when unknown. */
  Optional<StoredDocument> get(UUID documentId);

  /** Gets the chunks of a document in index order, with embeddings. */
  List<DocumentChunk> getChunks(UUID documentId);

  /**
   * Gets a document and its chunks from one snapshot, so a concurrent replace of the same source
   * never pairs the document with another version's chunks.
   *
   * @param documentId the document id
   * @return the document with its chunks in index order, empty when unknown
   */
  Optional<DocumentDetail> getWithChunks(UUID documentId);

  /** Lists documents, newest first. */
  List<DocumentSummary> list(int limit, int offset);

  /** Deletes every chunk and document. */
  void deleteAll();

  long countDocuments();

  long countChunks();
}
