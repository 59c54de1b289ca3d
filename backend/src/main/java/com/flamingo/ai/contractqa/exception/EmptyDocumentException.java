package com.flamingo.ai.contractqa.exception;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;

/** Exception thrown when a document has no extractable text. */
public class EmptyDocumentException extends PipelineException {

  private final String documentId;

  public EmptyDocumentException(String documentId) {
    super(
        ErrorKind.EMPTY_DOCUMENT,
        "Document " + documentId + " contains no extractable text",
        "The document is empty");
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
