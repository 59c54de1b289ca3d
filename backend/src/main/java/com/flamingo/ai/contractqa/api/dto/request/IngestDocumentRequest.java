package com.flamingo.ai.contractqa.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting contract text. Blank text is accepted and fails the build. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestDocumentRequest {

  @Pattern(
      regexp = "[A-Za-z0-9._-]{1,64}",
      message = "Document id must be 1-64 letters, digits, '.', '_' or '-'")
  private String documentId;

  @NotNull(message = "Text is required")
  @Size(max = 2_000_000, message = "Text must be at most 2000000 characters")
  private String text;
}
