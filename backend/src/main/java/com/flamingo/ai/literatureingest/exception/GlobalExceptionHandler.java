package com.flamingo.ai.literatureingest.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(IngestionAlreadyRunningException.class)
  public ResponseEntity<ApiError> handleAlreadyRunning(
      IngestionAlreadyRunningException ex, HttpServletRequest request) {
    incrementErrorCounter("ingestion_already_running");
    String errorId = generateErrorId();
    log.info("Run rejected [{}]: {}", errorId, ex.getMessage());
    return error(HttpStatus.CONFLICT, errorId, ApiError.INGESTION_ALREADY_RUNNING, ex, request);
  }

  @ExceptionHandler({LedgerCorruptedException.class, LedgerLockedException.class})
  public ResponseEntity<ApiError> handleLedger(
      FatalIngestionException ex, HttpServletRequest request) {
    incrementErrorCounter("ledger_error");
    String errorId = generateErrorId();
    log.error("Ledger error [{}]: {}", errorId, ex.getMessage());
    return error(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.LEDGER_ERROR, ex, request);
  }

  @ExceptionHandler(VectorStoreUnavailableException.class)
  public ResponseEntity<ApiError> handleVectorStore(
      VectorStoreUnavailableException ex, HttpServletRequest request) {
    incrementErrorCounter("vector_store_unavailable");
    String errorId = generateErrorId();
    log.error("Vector store unavailable [{}]: {}", errorId, ex.getMessage());
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.VECTOR_STORE_UNAVAILABLE, ex, request);
  }

  @ExceptionHandler(FatalIngestionException.class)
  public ResponseEntity<ApiError> handleFatal(
      FatalIngestionException ex, HttpServletRequest request) {
    incrementErrorCounter("ingestion_fatal");
    String errorId = generateErrorId();
    log.error("Fatal ingestion error [{}]: {}", errorId, ex.getMessage(), ex);
    return error(HttpStatus.SERVICE_UNAVAILABLE, errorId, ApiError.INGESTION_FATAL, ex, request);
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
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.VALIDATION_ERROR)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {
    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(ApiError.INTERNAL_ERROR)
                .message("An unexpected error occurred. Please try again later.")
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      RuntimeException ex,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(ex.getMessage())
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
