package com.flamingo.ai.contractqa.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for REST controllers. Errors are always written as JSON, also for
 * clients that asked for a Markdown answer.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(PipelineException.class)
  public ResponseEntity<ApiError> handlePipeline(
      PipelineException ex, HttpServletRequest request) {

    incrementErrorCounter(ex.getKind().name().toLowerCase(Locale.ROOT));
    String errorId = generateErrorId();
    HttpStatus status = statusFor(ex);
    String format = "Pipeline failure [{}] {} at {}: {}";
    if (status.is5xxServerError()) {
      log.error(format, errorId, ex.getKind(), ex.getStage(), ex.getMessage());
    } else {
      log.warn(format, errorId, ex.getKind(), ex.getStage(), ex.getMessage());
    }

    ApiError.ApiErrorBuilder body =
        ApiError.builder()
            .errorId(errorId)
            .code(codeFor(ex))
            .errorKind(ex.getKind())
            .stage(ex.getStage())
            .message(ex.getUserMessage())
            .path(request.getRequestURI())
            .timestamp(Instant.now());
    if (ex instanceof SchemaValidationExhaustedException exhausted) {
      body.violations(exhausted.getViolations());
    }
    return ResponseEntity.status(status)
        .contentType(MediaType.APPLICATION_JSON)
        .body(body.build());
  }

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_NOT_FOUND)
                .message("Document not found")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DocumentNotIndexedException.class)
  public ResponseEntity<ApiError> handleDocumentNotIndexed(
      DocumentNotIndexedException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_indexed");
    String errorId = generateErrorId();
    log.warn("Document not indexed [{}]: {}", errorId, ex.getDocumentId());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_NOT_INDEXED)
                .message("Document is not indexed yet")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(DocumentConflictException.class)
  public ResponseEntity<ApiError> handleDocumentConflict(
      DocumentConflictException ex, HttpServletRequest request) {

    incrementErrorCounter("document_conflict");
    String errorId = generateErrorId();
    log.warn("Document conflict [{}]: {}", errorId, ex.getDocumentId());

    return ResponseEntity.status(HttpStatus.CONFLICT)
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.DOCUMENT_CONFLICT)
                .message("A different document was already ingested under this id")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return badRequest(errorId, message, request);
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Bad request [{}]: {}", errorId, ex.getMessage());

    String message =
        ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
    return badRequest(errorId, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  static HttpStatus statusFor(PipelineException ex) {
    return switch (ex.getKind()) {
      case EMPTY_DOCUMENT -> HttpStatus.UNPROCESSABLE_ENTITY;
      case INDEX_BUILD -> HttpStatus.INTERNAL_SERVER_ERROR;
      case EMBEDDING_SERVICE, GENERATION_SERVICE -> HttpStatus.SERVICE_UNAVAILABLE;
      case SCHEMA_VALIDATION_EXHAUSTED -> HttpStatus.BAD_GATEWAY;
      case CANCELLED -> HttpStatus.CONFLICT;
      case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
    };
  }

  private static String codeFor(PipelineException ex) {
    return switch (ex.getKind()) {
      case EMPTY_DOCUMENT -> ApiError.DOCUMENT_EMPTY;
      case INDEX_BUILD -> ApiError.INDEX_BUILD_FAILED;
      case EMBEDDING_SERVICE -> ApiError.EMBEDDING_UNAVAILABLE;
      case GENERATION_SERVICE -> ApiError.LLM_UNAVAILABLE;
      case SCHEMA_VALIDATION_EXHAUSTED -> ApiError.ANSWER_INVALID;
      case CANCELLED -> ApiError.RUN_CANCELLED;
      case TIMEOUT -> ApiError.TIMEOUT;
    };
  }

  private ResponseEntity<ApiError> badRequest(
      String errorId, String message, HttpServletRequest request) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .contentType(MediaType.APPLICATION_JSON)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
