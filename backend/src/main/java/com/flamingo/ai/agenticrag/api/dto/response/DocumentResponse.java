package com.flamingo.ai.agenticrag.api.dto.response;

import com.flamingo.ai.agenticrag.service.rag.model.DocumentChunk;
import com.flamingo.ai.agenticrag.service.rag.model.DocumentDetail;
import com.flamingo.ai.agenticrag.service.rag.model.StoredDocument;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a document with its chunks. Embeddings are reported by size only. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String title;
  private String source;
  private String content;
  private Map<String, Object> metadata;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;
  private List<ChunkResponse> chunks;

  /** One chunk of the document. */
  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ChunkResponse {
    private int index;
    private int startChar;
    private int endChar;
    private String content;
    private int tokenCount;
    private int embeddingDimensions;
    private Map<String, Object> metadata;

    static ChunkResponse fromChunk(DocumentChunk chunk) {
      return ChunkResponse.builder()
          .index(chunk.index())
          .startChar(chunk.startChar())
          .endChar(chunk.endChar())
          .content(chunk.content())
          .tokenCount(chunk.tokenCount())
          .embeddingDimensions(chunk.hasEmbedding() ? chunk.embedding().size() : 0)
          .metadata(chunk.metadata())
          .build();
    }
  }

  /** Creates a DocumentResponse from a document and its chunks. */
  public static DocumentResponse fromDetail(DocumentDetail detail) {
    StoredDocument document = detail.document();
    return DocumentResponse.builder()
        .id(document.id())
        .title(document.title())
        .source(document.source())
        .content(document.content())
        .metadata(document.metadata())
        .createdAt(document.createdAt())
        .updatedAt(document.updatedAt())
        .chunks(detail.chunks().stream().map(ChunkResponse::fromChunk).toList())
        .build();
  }
}
