package com.flamingo.ai.contractqa.exception;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;

/** Exception thrown when the evidence index for a document cannot be built. */
public class IndexBuildException extends PipelineException {

  private final String documentId;

  public IndexBuildException(String documentId, String message) {
    super(ErrorKind.INDEX_BUILD, message, "Failed to index document");
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
