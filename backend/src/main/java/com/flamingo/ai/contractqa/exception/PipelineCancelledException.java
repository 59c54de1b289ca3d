package com.flamingo.ai.contractqa.exception;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;

/** Exception thrown when an in-flight run is cancelled. */
public class PipelineCancelledException extends PipelineException {

  public PipelineCancelledException() {
    super(ErrorKind.CANCELLED, "Run was cancelled", "The request was cancelled");
  }
}
