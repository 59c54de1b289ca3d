package com.flamingo.ai.contractqa.exception;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;
import java.time.Duration;

/** Exception thrown when an external call exceeds its time limit. */
public class StageTimeoutException extends PipelineException {

  private final String operation;
  private final Duration timeout;

  public StageTimeoutException(String operation, Duration timeout, Throwable cause) {
    super(
        ErrorKind.TIMEOUT,
        String.format("%s call timed out after %d ms", operation, timeout.toMillis()),
        "The request timed out. Please try again later.",
        cause);
    this.operation = operation;
    this.timeout = timeout;
  }

  public String getOperation() {
    return operation;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
