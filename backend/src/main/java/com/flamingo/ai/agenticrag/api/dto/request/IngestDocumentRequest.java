package com.flamingo.ai.agenticrag.api.dto.request;

import com.flamingo.ai.agenticrag.service.rag.model.SourceDocument;
import jakarta.validation.constraints.NotBlank;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a text document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestDocumentRequest {

  /** Defaults to the source when blank. */
  private String title;

  @NotBlank(message = "Source is required")
  private String source;

  @NotBlank(message = "Content is required")
  private String content;

  private Map<String, Object> metadata;

  public SourceDocument toSourceDocument() {
    return new SourceDocument(title, source, content, metadata);
  }
}
