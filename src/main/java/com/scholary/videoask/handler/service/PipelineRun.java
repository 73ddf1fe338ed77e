package com.scholary.videoask.handler.service;

import com.scholary.videoask.handler.logging.StructuredLogger;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of a single pipeline run.
 *
 * <p>Lives for one request only and is never shared between threads; the provider job id is the
 * only identity that outlives it.
 */
public class PipelineRun {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineRun.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final String runId;
  private PipelineStage stage;
  private String jobId;
  private String failureReason;

  private PipelineRun(String runId, PipelineStage stage) {
    this.runId = runId;
    this.stage = stage;
  }

  /** A run for a new submission. */
  public static PipelineRun received() {
    return new PipelineRun(UUID.randomUUID().toString(), PipelineStage.RECEIVED);
  }

  /** A run resumed from a provider callback for an already submitted job. */
  public static PipelineRun awaitingCallback(String jobId) {
    PipelineRun run =
        new PipelineRun(UUID.randomUUID().toString(), PipelineStage.AWAITING_CALLBACK);
    run.jobId = jobId;
    return run;
  }

  /**
   * Move to the next stage.
   *
   * @throws IllegalStateException if the transition is not allowed from the current stage
   */
  public void advance(PipelineStage next) {
    if (!stage.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Illegal pipeline transition %s -> %s (run %s)", stage, next, runId));
    }
    structuredLogger.logStageTransition(runId, stage.name(), next.name());
    stage = next;
  }

  public void submitted(String jobId) {
    this.jobId = jobId;
    advance(PipelineStage.SUBMITTED);
  }

  public void fail(String reason) {
    advance(PipelineStage.FAILED);
    this.failureReason = reason;
  }

  public String runId() {
    return runId;
  }

  public PipelineStage stage() {
    return stage;
  }

  public String jobId() {
    return jobId;
  }

  public String failureReason() {
    return failureReason;
  }
}
