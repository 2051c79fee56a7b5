package com.flamingo.ai.agenticrag.service.store;

import com.flamingo.ai.agenticrag.domain.entity.Chunk;
import com.flamingo.ai.agenticrag.domain.entity.Document;
import com.flamingo.ai.agenticrag.domain.repository.ChunkRepository;
import com.flamingo.ai.agenticrag.domain.repository.DocumentRepository;
import com.flamingo.ai.agenticrag.exception.StorageException;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentChunk;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentDetail;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentSummary;
import com.flamingo.ai.agenticrag.service.rag.model.SourceDocument;
import com.flamingo.ai.agenticrag.service.rag.model.StoredDocument;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/** PostgreSQL implementation of the DocumentStore. */
@Service
@Slf4j
public class DocumentStoreImpl implements DocumentStore {

  private static final String LIST_QUERY =
      "SELECT d, (SELECT COUNT(c) FROM Chunk c WHERE c.document = d) FROM Document d "
          + "ORDER BY d.createdAt DESC, d.id";

  private final DocumentRepository documentRepository;
  private final ChunkRepository chunkRepository;
  private final TransactionTemplate transactionTemplate;
  private final MeterRegistry meterRegistry;

  @PersistenceContext private EntityManager entityManager;

  public DocumentStoreImpl(
      DocumentRepository documentRepository,
      ChunkRepository chunkRepository,
      TransactionTemplate transactionTemplate,
      MeterRegistry meterRegistry) {
    this.documentRepository = documentRepository;
    this.chunkRepository = chunkRepository;
    this.transactionTemplate = transactionTemplate;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "store.save", description = "Time to store a document with its chunks")
  public UUID save(SourceDocument document, List<DocumentChunk> chunks) {
    AtomicReference<UUID> documentId = new AtomicReference<>();
    try {
      transactionTemplate.executeWithoutResult(
          status -> {
            int replaced = documentRepository.deleteBySource(document.source());
            if (replaced > 0) {
              log.info("Replacing previously stored document for source {}", document.source());
            }

            Document saved =
                documentRepository.save(
                    Document.builder()
                        .title(document.title())
                        .source(document.source())
                        .content(document.content())
                        .metadata(new HashMap<>(document.metadata()))
                        .build());
            documentId.set(saved.getId());

            for (DocumentChunk chunk : chunks) {
              chunkRepository.save(toEntity(saved, chunk));
            }
            chunkRepository.flush();

            if (Thread.currentThread().isInterrupted()) {
              throw new StorageException(
                  saved.getId(), "Interrupted before commit, rolling back", null);
            }
          });
    } catch (StorageException e) {
      meterRegistry.counter("store.save.failure").increment();
      throw e;
    } catch (DataAccessException | TransactionException | PersistenceException e) {
      meterRegistry.counter("store.save.failure").increment();
      log.error(
          "Failed to store document {} from {}: {}",
          documentId.get(),
          document.source(),
          e.getMessage(),
          e);
      throw new StorageException(
          documentId.get(),
          "Failed to store document from " + document.source() + ": " + e.getMessage(),
          e);
    }

    meterRegistry.counter("store.save.success").increment();
    log.info(
        "Stored document {} from {} with {} chunks",
        documentId.get(),
        document.source(),
        chunks.size());
    return documentId.get();
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<StoredDocument> get(UUID documentId) {
    return documentRepository.findById(documentId).map(StoredDocument::fromEntity);
  }

  @Override
  @Transactional(readOnly = true)
  public List<DocumentChunk> getChunks(UUID documentId) {
    return chunkRepository.findByDocumentIdOrderByChunkIndexAsc(documentId).stream()
        .map(DocumentStoreImpl::toDomain)
        .toList();
  }

  @Override
  @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
  public Optional<DocumentDetail> getWithChunks(UUID documentId) {
    return get(documentId).map(document -> new DocumentDetail(document, getChunks(documentId)));
  }

  @Override
  @Transactional(readOnly = true)
  public List<DocumentSummary> list(int limit, int offset) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Limit must be positive: " + limit);
    }
    if (offset < 0) {
      throw new IllegalArgumentException("Offset must not be negative: " + offset);
    }
    List<Object[]> rows =
        entityManager
            .createQuery(LIST_QUERY, Object[].class)
            .setFirstResult(offset)
            .setMaxResults(limit)
            .getResultList();

    List<DocumentSummary> summaries = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      Document document = (Document) row[0];
      summaries.add(
          new DocumentSummary(
              document.getId(),
              document.getTitle(),
              document.getSource(),
              copyOf(document.getMetadata()),
              document.getCreatedAt(),
              document.getUpdatedAt(),
              ((Number) row[1]).longValue()));
    }
    return summaries;
  }

  @Override
  @Transactional
  @Timed(value = "store.deleteAll", description = "Time to delete all documents")
  public void deleteAll() {
    chunkRepository.deleteAllInBatch();
    documentRepository.deleteAllInBatch();
    meterRegistry.counter("store.deleteAll").increment();
    log.info("Deleted all documents and chunks");
  }

  @Override
  @Transactional(readOnly = true)
  public long countDocuments() {
    return documentRepository.count();
  }

  @Override
  @Transactional(readOnly = true)
  public long countChunks() {
    return chunkRepository.count();
  }

  private static Chunk toEntity(Document document, DocumentChunk chunk) {
    return Chunk.builder()
        .document(document)
        .chunkIndex(chunk.index())
        .startChar(chunk.startChar())
        .endChar(chunk.endChar())
        .content(chunk.content())
        .tokenCount(chunk.tokenCount())
        .embedding(toArray(chunk.embedding()))
        .metadata(new HashMap<>(chunk.metadata()))
        .build();
  }

  private static DocumentChunk toDomain(Chunk chunk) {
    return new DocumentChunk(
        chunk.getChunkIndex(),
        chunk.getStartChar(),
        chunk.getEndChar(),
        chunk.getContent(),
        chunk.getTokenCount(),
        toList(chunk.getEmbedding()),
        copyOf(chunk.getMetadata()));
  }

  private static float[] toArray(List<Float> vector) {
    if (vector == null) {
      return null;
    }
    float[] array = new float[vector.size()];
    for (int i = 0; i < array.length; i++) {
      array[i] = vector.get(i);
    }
    return array;
  }

  private static List<Float> toList(float[] vector) {
    if (vector == null) {
      return null;
    }
    List<Float> list = new ArrayList<>(vector.length);
    for (float f : vector) {
      list.add(f);
    }
    return list;
  }

  private static Map<String, Object> copyOf(Map<String, Object> metadata) {
    return metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
  }
}
