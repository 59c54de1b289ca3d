package com.flamingo.ai.contractqa.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for asking a question about a document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

  @NotBlank(message = "Question is required")
  @Size(max = 10000, message = "Question must be at most 10000 characters")
  private String question;

  /** Number of clauses to retrieve; the configured default when absent. */
  @Positive(message = "topK must be positive")
  private Integer topK;

  /** Optional caller-chosen id for polling and cancelling the run. */
  @Pattern(regexp = "[A-Za-z0-9._-]{1,64}", message = "Invalid run id")
  private String runId;
}
