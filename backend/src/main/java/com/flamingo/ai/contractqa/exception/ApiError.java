package com.flamingo.ai.contractqa.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.contractqa.domain.enums.ErrorKind;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_EMPTY = "DOCUMENT_002";
  public static final String DOCUMENT_NOT_INDEXED = "DOCUMENT_003";
  public static final String DOCUMENT_CONFLICT = "DOCUMENT_004";
  public static final String INDEX_BUILD_FAILED = "INDEX_001";
  public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_001";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String ANSWER_INVALID = "LLM_002";
  public static final String RUN_CANCELLED = "RUN_001";
  public static final String TIMEOUT = "TIMEOUT_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** Pipeline error kind, present for pipeline failures only. */
  private final ErrorKind errorKind;

  /** Stage the run was in when it failed. */
  private final String stage;

  /** User-friendly error message. */
  private final String message;

  /** Schema violations of the last rejected answer. */
  private final List<String> violations;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
