package com.flamingo.ai.contractqa.exception;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;

/** Exception thrown when the generation service produces no output at all. */
public class GenerationServiceException extends PipelineException {

  private static final String USER_MESSAGE =
      "AI service is temporarily unavailable. Please try again later.";

  public GenerationServiceException(String message) {
    super(ErrorKind.GENERATION_SERVICE, message, USER_MESSAGE);
  }

  public GenerationServiceException(String message, Throwable cause) {
    super(ErrorKind.GENERATION_SERVICE, message, USER_MESSAGE, cause);
  }
}
