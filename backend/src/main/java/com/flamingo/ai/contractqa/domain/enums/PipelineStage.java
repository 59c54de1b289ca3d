package com.flamingo.ai.contractqa.domain.enums;

/** A state of a pipeline run together with its allowed successors. */
public interface PipelineStage {

  boolean isTerminal();

  boolean canTransitionTo(PipelineStage next);
}
