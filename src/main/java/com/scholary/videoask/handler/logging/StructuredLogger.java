package com.scholary.videoask.handler.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each pipeline event is logged with its fields in MDC so they can be queried in the log
 * store. Event fields are removed again after the call; job context fields stay until the caller
 * clears them.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a pipeline stage transition. */
  public void logStageTransition(String runId, String from, String to) {
    try {
      MDC.put("event_type", "stage_transition");
      MDC.put("runId", runId);
      MDC.put("fromStage", from);
      MDC.put("stage", to);

      logger.debug("Pipeline stage: run={}, {} -> {}", runId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log a successful job submission. */
  public void logJobSubmitted(String jobId, String mediaUrl, String email, String question) {
    try {
      MDC.put("event_type", "job_submitted");
      MDC.put("jobId", jobId);
      MDC.put("mediaUrl", mediaUrl);

      logger.info(
          "Job submitted: jobId={}, mediaUrl={}, email={}, question={}",
          jobId,
          mediaUrl,
          email,
          question);
    } finally {
      clearEventFields();
    }
  }

  /** Log a retry of an outbound call. */
  public void logRetry(
      String operation, int attempt, int maxAttempts, long backoffMs, String errorType,
      String message) {
    try {
      MDC.put("event_type", "call_retry");
      MDC.put("operation", operation);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxAttempts", String.valueOf(maxAttempts));
      MDC.put("backoffMs", String.valueOf(backoffMs));
      MDC.put("errorType", errorType);

      logger.warn(
          "Retrying {}: attempt={}/{}, backoff={}ms, error={}, message={}",
          operation,
          attempt,
          maxAttempts,
          backoffMs,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log an outbound call that failed for good. */
  public void logCallFailed(String operation, int attempts, String errorType, String message) {
    try {
      MDC.put("event_type", "call_failed");
      MDC.put("operation", operation);
      MDC.put("attempt", String.valueOf(attempts));
      MDC.put("errorType", errorType);

      logger.error(
          "{} failed: attempts={}, error={}, message={}", operation, attempts, errorType, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log receipt of a provider callback. */
  public void logCallbackReceived(String jobId, String status) {
    try {
      MDC.put("event_type", "callback_received");
      MDC.put("jobId", jobId);
      MDC.put("jobStatus", status);

      logger.info("Callback received: jobId={}, status={}", jobId, status);
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of writing a record to the result store. */
  public void logRecordStored(String jobId, String email, String question, boolean stored) {
    try {
      MDC.put("event_type", stored ? "record_stored" : "record_not_stored");
      MDC.put("jobId", jobId);

      if (stored) {
        logger.info("Record stored: jobId={}, email={}, question={}", jobId, email, question);
      } else {
        logger.warn("Record NOT stored: jobId={}, email={}, question={}", jobId, email, question);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Set request correlation id in MDC. */
  public static void setRequestContext(String correlationId) {
    MDC.put("correlationId", correlationId);
  }

  /** Clear request correlation id from MDC. */
  public static void clearRequestContext() {
    MDC.remove("correlationId");
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String email, String question) {
    MDC.put("jobId", jobId);
    MDC.put("email", email);
    MDC.put("question", question);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("email");
    MDC.remove("question");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("runId");
    MDC.remove("fromStage");
    MDC.remove("stage");
    MDC.remove("mediaUrl");
    MDC.remove("operation");
    MDC.remove("attempt");
    MDC.remove("maxAttempts");
    MDC.remove("backoffMs");
    MDC.remove("errorType");
    MDC.remove("jobStatus");
  }
}
