package com.flamingo.ai.contractqa.api.rest;

import com.flamingo.ai.contractqa.api.dto.request.IngestDocumentRequest;
import com.flamingo.ai.contractqa.api.dto.response.DocumentResponse;
import com.flamingo.ai.contractqa.exception.DocumentNotFoundException;
import com.flamingo.ai.contractqa.service.pipeline.DocumentBuildRecord;
import com.flamingo.ai.contractqa.service.pipeline.DocumentPipelineOrchestrator;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document ingestion. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentPipelineOrchestrator documentPipeline;

  /** Ingests contract text and starts building its index in the background. */
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<DocumentResponse> ingest(
      @Valid @RequestBody IngestDocumentRequest request) {
    String documentId =
        request.getDocumentId() != null ? request.getDocumentId() : UUID.randomUUID().toString();
    DocumentBuildRecord record = documentPipeline.ingestAsync(documentId, request.getText());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(DocumentResponse.fromRecord(record));
  }

  /** Gets the build status of a document. */
  @GetMapping("/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable String documentId) {
    DocumentBuildRecord record =
        documentPipeline
            .find(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    return ResponseEntity.ok(DocumentResponse.fromRecord(record));
  }
}
