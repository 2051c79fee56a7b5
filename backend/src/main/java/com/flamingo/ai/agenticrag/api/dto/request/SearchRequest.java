package com.flamingo.ai.agenticrag.api.dto.request;

import com.flamingo.ai.agenticrag.domain.enums.SearchType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for searching the knowledge base. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  @Min(value = 1, message = "Limit must be at least 1")
  @Max(value = 50, message = "Limit must not exceed 50")
  @Builder.Default
  private int limit = 10;

  @Builder.Default private SearchType searchType = SearchType.HYBRID;

  /** Share of keyword relevance in hybrid search. */
  @DecimalMin(value = "0.0", message = "Text weight must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "Text weight must be between 0 and 1")
  @Builder.Default
  private double textWeight = 0.3;
}
