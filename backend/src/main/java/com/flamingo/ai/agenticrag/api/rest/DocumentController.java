package com.flamingo.ai.agenticrag.api.rest;

import com.flamingo.ai.agenticrag.api.dto.request.IngestDocumentRequest;
import com.flamingo.ai.agenticrag.api.dto.response.DocumentResponse;
import com.flamingo.ai.agenticrag.exception.DocumentNotFoundException;
import com.flamingo.ai.agenticrag.service.ingestion.IngestionPipeline;
import com.flamingo.ai.agenticrag.service.ingestion.IngestionResult;
import com.flamingo.ai.agenticrag.service.ingestion.IngestionStatus;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentDetail;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentSummary;
import com.flamingo.ai.agenticrag.service.store.DocumentStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document management. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentStore documentStore;
  private final IngestionPipeline ingestionPipeline;

  /** Lists documents, newest first. */
  @GetMapping
  public ResponseEntity<List<DocumentSummary>> listDocuments(
      @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
      @RequestParam(defaultValue = "0") @Min(0) int offset) {
    return ResponseEntity.ok(documentStore.list(limit, offset));
  }

  /** Gets a document with its chunks in order. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    DocumentDetail detail =
        documentStore
            .getWithChunks(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    return ResponseEntity.ok(DocumentResponse.fromDetail(detail));
  }

  /**
   * Ingests a text document, replacing any document with the same source. Answers 201 when the
   * document was stored and 200 when it was skipped because it yields no chunks.
   */
  @PostMapping
  public ResponseEntity<IngestionResult> ingestDocument(
      @Valid @RequestBody IngestDocumentRequest request) {
    IngestionResult result = ingestionPipeline.ingest(request.toSourceDocument());
    HttpStatus status =
        result.status() == IngestionStatus.SUCCEEDED ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status).body(result);
  }

  /** Deletes every document and chunk. */
  @DeleteMapping
  public ResponseEntity<Void> deleteAllDocuments() {
    documentStore.deleteAll();
    return ResponseEntity.noContent().build();
  }
}
