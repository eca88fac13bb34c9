package com.flamingo.ai.summarizer.exception;

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

  @ExceptionHandler(SummarizationCancelledException.class)
  public ResponseEntity<ApiError> handleSummarizationCancelled(
      SummarizationCancelledException ex, HttpServletRequest request) {

    incrementErrorCounter("summarization_cancelled");
    String errorId = generateErrorId();
    log.warn("Summarization cancelled [{}] during {}", errorId, ex.getFailedIn());

    return error(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.SUMMARIZATION_CANCELLED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(SummarizationException.class)
  public ResponseEntity<ApiError> handleSummarization(
      SummarizationException ex, HttpServletRequest request) {

    if (ex.getCause() instanceof LlmServiceException llm) {
      return handleLlmService(llm, request);
    }

    incrementErrorCounter("summarization_failed");
    String errorId = generateErrorId();
    log.error(
        "Summarization failed [{}] during {}: {}", errorId, ex.getFailedIn(), ex.getMessage(), ex);

    return error(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.SUMMARIZATION_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isTimedOut() ? "llm_timeout" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isTimedOut() ? ApiError.LLM_TIMEOUT : ApiError.LLM_UNAVAILABLE;
    return error(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), request);
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

    return error(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> error(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
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
