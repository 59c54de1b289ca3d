package com.flamingo.ai.contractqa.exception;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;

/** Exception thrown when the embedding service fails. */
public class EmbeddingServiceException extends PipelineException {

  private static final String USER_MESSAGE =
      "Embedding service is temporarily unavailable. Please try again later.";

  private final boolean retryable;

  public EmbeddingServiceException(String message, Throwable cause) {
    super(ErrorKind.EMBEDDING_SERVICE, message, USER_MESSAGE, cause);
    this.retryable = true;
  }

  public EmbeddingServiceException(String message, boolean retryable) {
    super(ErrorKind.EMBEDDING_SERVICE, message, USER_MESSAGE);
    this.retryable = retryable;
  }

  @Override
  public boolean isRetryable() {
    return retryable;
  }
}
