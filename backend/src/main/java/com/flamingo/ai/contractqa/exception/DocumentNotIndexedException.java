package com.flamingo.ai.contractqa.exception;

/** Exception thrown when a query targets a document without a published evidence index. */
public class DocumentNotIndexedException extends RuntimeException {

  private final String documentId;

  public DocumentNotIndexedException(String documentId) {
    super("Document is not indexed: " + documentId);
    this.documentId = documentId;
  }

  public String getDocumentId() {
    return documentId;
  }
}
