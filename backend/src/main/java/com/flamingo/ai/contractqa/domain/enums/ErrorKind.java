package com.flamingo.ai.contractqa.domain.enums;

/** Classifies terminal pipeline failures. */
public enum ErrorKind {
  /** No extractable text remained after segmentation input checks. */
  EMPTY_DOCUMENT(false),

  /** The evidence index could not be built. */
  INDEX_BUILD(false),

  /** The embedding service failed. */
  EMBEDDING_SERVICE(true),

  /** The generation service failed to produce any output. */
  GENERATION_SERVICE(true),

  /** Every repair attempt produced an answer that failed schema validation. */
  SCHEMA_VALIDATION_EXHAUSTED(false),

  /** The run was cancelled by the caller. */
  CANCELLED(false),

  /** An external call exceeded its time limit. */
  TIMEOUT(true);

  private final boolean transientFailure;

  ErrorKind(boolean transientFailure) {
    this.transientFailure = transientFailure;
  }

  /** Whether failures of this kind may be retried by the orchestrator. */
  public boolean isTransient() {
    return transientFailure;
  }
}
