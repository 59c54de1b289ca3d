package com.flamingo.ai.contractqa.service.pipeline;

import com.flamingo.ai.contractqa.domain.enums.BuildStage;
import com.flamingo.ai.contractqa.domain.enums.ErrorKind;
import com.flamingo.ai.contractqa.domain.enums.PipelineStage;
import com.flamingo.ai.contractqa.domain.enums.QueryStage;
import java.time.Instant;

/**
 * Mutable progress record of one build or query run. Only the owning orchestrator mutates it;
 * other threads read it through {@link #view()}.
 *
 * @param <S> stage enum of the run
 */
public final class RunState<S extends Enum<S> & PipelineStage> {

  private final String runId;
  private final S failedStage;
  private final Instant startedAt;

  private S stage;
  private int attemptCount;
  private int serviceRetryCount;
  private ErrorKind lastError;
  private Instant updatedAt;

  private RunState(String runId, S initialStage, S failedStage) {
    this.runId = runId;
    this.stage = initialStage;
    this.failedStage = failedStage;
    this.startedAt = Instant.now();
    this.updatedAt = startedAt;
  }

  public static RunState<QueryStage> forQuery(String runId) {
    return new RunState<>(runId, QueryStage.IDLE, QueryStage.FAILED);
  }

  public static RunState<BuildStage> forBuild(String runId) {
    return new RunState<>(runId, BuildStage.IDLE, BuildStage.FAILED);
  }

  /**
   * Moves the run to the next stage.
   *
   * @throws IllegalStateException if the stage machine does not allow the transition
   */
  public synchronized void transitionTo(S next) {
    if (!stage.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Run %s cannot move from %s to %s", runId, stage, next));
    }
    stage = next;
    updatedAt = Instant.now();
  }

  /**
   * Moves the run to its failed stage and records the error kind.
   *
   * @param kind error kind, or null for failures outside the pipeline taxonomy
   * @return false if the run had already reached a terminal stage
   */
  public synchronized boolean fail(ErrorKind kind) {
    if (stage.isTerminal()) {
      return false;
    }
    lastError = kind;
    transitionTo(failedStage);
    return true;
  }

  /** Counts one generator invocation. */
  public synchronized int recordGenerationAttempt() {
    updatedAt = Instant.now();
    return ++attemptCount;
  }

  /** Counts one retry of a transient service failure. Separate from generation attempts. */
  public synchronized int recordServiceRetry() {
    updatedAt = Instant.now();
    return ++serviceRetryCount;
  }

  public String getRunId() {
    return runId;
  }

  public synchronized S getStage() {
    return stage;
  }

  public synchronized int getAttemptCount() {
    return attemptCount;
  }

  public synchronized int getServiceRetryCount() {
    return serviceRetryCount;
  }

  public synchronized ErrorKind getLastError() {
    return lastError;
  }

  public synchronized RunStateView view() {
    return new RunStateView(
        runId, stage.name(), attemptCount, serviceRetryCount, lastError, startedAt, updatedAt);
  }
}
