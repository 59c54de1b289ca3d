package com.flamingo.ai.contractqa.api.dto.response;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;
import com.flamingo.ai.contractqa.service.pipeline.DocumentBuildRecord;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document build status. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private String documentId;
  private String stage;
  private Integer unitCount;
  private ErrorKind lastError;
  private String contentHash;
  private Instant startedAt;
  private Instant updatedAt;

  /** Creates a DocumentResponse from a build record. */
  public static DocumentResponse fromRecord(DocumentBuildRecord record) {
    return DocumentResponse.builder()
        .documentId(record.documentId())
        .stage(record.run().stage())
        .unitCount(record.unitCount())
        .lastError(record.run().lastError())
        .contentHash(record.contentHash())
        .startedAt(record.run().startedAt())
        .updatedAt(record.run().updatedAt())
        .build();
  }
}
