package com.flamingo.ai.contractqa.exception;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;

/**
 * Base class for failures raised by pipeline components.
 *
 * <p>Components only report failures; the orchestrator decides whether to retry and tags the
 * exception with the stage it was running when the failure became terminal.
 */
public abstract class PipelineException extends RuntimeException {

  private final ErrorKind kind;
  private final String userMessage;
  private volatile String stage;

  protected PipelineException(ErrorKind kind, String message, String userMessage) {
    super(message);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  protected PipelineException(
      ErrorKind kind, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.userMessage = userMessage;
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getUserMessage() {
    return userMessage;
  }

  /** The stage the run was in when it failed, or null if the failure never reached a run. */
  public String getStage() {
    return stage;
  }

  /** Whether the orchestrator may retry the call that raised this failure. */
  public boolean isRetryable() {
    return kind.isTransient();
  }

  /**
   * Records the failing stage. The first recorded stage wins.
   *
   * @param stageName stage name
   * @return this exception
   */
  public PipelineException atStage(String stageName) {
    if (this.stage == null) {
      this.stage = stageName;
    }
    return this;
  }
}
