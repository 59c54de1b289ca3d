package com.flamingo.ai.contractqa.domain.model;

/**
 * A question about a document.
 *
 * @param text question text
 * @param topK maximum number of clauses to retrieve as evidence
 */
public record ContractQuery(String text, int topK) {

  public ContractQuery {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Query text must not be blank");
    }
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be positive, got " + topK);
    }
  }
}
