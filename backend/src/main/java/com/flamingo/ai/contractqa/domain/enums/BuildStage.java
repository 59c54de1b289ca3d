package com.flamingo.ai.contractqa.domain.enums;

/** Build-time states of a document: ingest, segment and index. */
public enum BuildStage implements PipelineStage {
  IDLE,
  INGESTING,
  SEGMENTING,
  INDEXING,
  INDEXED,
  FAILED;

  @Override
  public boolean isTerminal() {
    return this == INDEXED || this == FAILED;
  }

  @Override
  public boolean canTransitionTo(PipelineStage next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return switch (this) {
      case IDLE -> next == INGESTING;
      case INGESTING -> next == SEGMENTING;
      case SEGMENTING -> next == INDEXING;
      case INDEXING -> next == INDEXED;
      default -> false;
    };
  }
}
