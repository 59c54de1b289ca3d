package com.flamingo.ai.contractqa.exception;

/** Exception thrown when a document id is re-ingested with different content. */
public class DocumentConflictException extends RuntimeException {

  private final String documentId;

  public DocumentConflictException(String documentId) {
    super("Document " + documentId + " was already ingested with different content");
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
