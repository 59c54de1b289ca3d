package com.flamingo.ai.contractqa.domain.enums;

/**
 * Query-time states. {@code VALIDATING} either finishes the run or loops back to {@code
 * GENERATING} for a repair attempt; {@code RETRIEVING} may finish directly when no evidence was
 * found.
 */
public enum QueryStage implements PipelineStage {
  IDLE,
  RETRIEVING,
  GENERATING,
  VALIDATING,
  DONE,
  FAILED;

  @Override
  public boolean isTerminal() {
    return this == DONE || this == FAILED;
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
      case IDLE -> next == RETRIEVING;
      case RETRIEVING -> next == GENERATING || next == DONE;
      case GENERATING -> next == VALIDATING;
      case VALIDATING -> next == DONE || next == GENERATING;
      default -> false;
    };
  }
}
