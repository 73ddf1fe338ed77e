package com.scholary.videoask.handler.api;

import com.scholary.videoask.handler.config.ConfigurationException;
import com.scholary.videoask.handler.media.MediaValidationException;
import com.scholary.videoask.handler.revai.JobFailedException;
import com.scholary.videoask.handler.revai.ProviderException;
import com.scholary.videoask.handler.revai.TranscriptionTimeoutException;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps pipeline exceptions to structured JSON errors.
 *
 * <ul>
 *   <li>400: invalid request body or unsupported media
 *   <li>500: missing configuration
 *   <li>502: provider failure or failed job
 *   <li>504: synchronous wait ran out
 * </ul>
 *
 * <p>The webhook and batch endpoints report item failures in their body and do not reach this
 * handler for them.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Invalid request: {}", details);
    return error(HttpStatus.BAD_REQUEST, "ValidationError", "Invalid request", details);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return error(
        HttpStatus.BAD_REQUEST, "ValidationError", "Invalid request", "Malformed JSON body");
  }

  @ExceptionHandler(MediaValidationException.class)
  public ResponseEntity<ApiError> handleInvalidMedia(MediaValidationException ex) {
    LOGGER.warn("Invalid media: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "ValidationError", "Invalid media", ex.getMessage());
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ApiError> handleConfiguration(ConfigurationException ex) {
    LOGGER.error("Configuration error: {}", ex.getMessage());
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "ConfigurationError",
        "Service is not configured",
        ex.getMessage());
  }

  @ExceptionHandler(ProviderException.class)
  public ResponseEntity<ApiError> handleProvider(ProviderException ex) {
    LOGGER.error("Provider error: status={}, message={}", ex.getStatusCode(), ex.getMessage());
    return error(
        HttpStatus.BAD_GATEWAY, "ProviderError", "Transcription provider error", ex.getMessage());
  }

  @ExceptionHandler(JobFailedException.class)
  public ResponseEntity<ApiError> handleJobFailed(JobFailedException ex) {
    LOGGER.warn("Job failed: jobId={}, detail={}", ex.getJobId(), ex.getFailureDetail());
    return error(
        HttpStatus.BAD_GATEWAY, "JobFailedError", "Transcription job failed", ex.getMessage());
  }

  @ExceptionHandler(TranscriptionTimeoutException.class)
  public ResponseEntity<ApiError> handleTimeout(TranscriptionTimeoutException ex) {
    LOGGER.warn("Wait timed out: jobId={}, maxWait={}", ex.getJobId(), ex.getMaxWait());
    return error(
        HttpStatus.GATEWAY_TIMEOUT,
        "TimeoutError",
        "Transcription did not finish in time",
        ex.getMessage());
  }

  private static ResponseEntity<ApiError> error(
      HttpStatus status, String errorCode, String message, String details) {
    return ResponseEntity.status(status)
        .body(new ApiError(errorCode, message, details, Instant.now()));
  }
}
