package com.scholary.videoask.handler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PipelineRunTest {

  @Test
  void advance_shouldFollowSubmissionPath() {
    PipelineRun run = PipelineRun.received();

    run.advance(PipelineStage.VALIDATED);
    run.submitted("job-1");
    run.advance(PipelineStage.POLLING);
    run.advance(PipelineStage.RECONCILED);
    run.advance(PipelineStage.STORED);

    assertThat(run.stage()).isEqualTo(PipelineStage.STORED);
    assertThat(run.jobId()).isEqualTo("job-1");
    assertThat(run.stage().isTerminal()).isTrue();
  }

  @Test
  void advance_shouldRejectSkippedStage() {
    PipelineRun run = PipelineRun.received();

    assertThatThrownBy(() -> run.advance(PipelineStage.SUBMITTED))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("RECEIVED -> SUBMITTED");
    assertThat(run.stage()).isEqualTo(PipelineStage.RECEIVED);
  }

  @Test
  void advance_shouldRejectAnyMoveOutOfTerminalStage() {
    PipelineRun run = PipelineRun.awaitingCallback("job-1");
    run.fail("Transcription failed");

    assertThat(run.failureReason()).isEqualTo("Transcription failed");
    assertThatThrownBy(() -> run.advance(PipelineStage.RECONCILED))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> run.fail("again")).isInstanceOf(IllegalStateException.class);
    assertThat(run.failureReason()).isEqualTo("Transcription failed");
  }

  @Test
  void awaitingCallback_shouldCarryJobId() {
    PipelineRun run = PipelineRun.awaitingCallback("job-7");

    assertThat(run.stage()).isEqualTo(PipelineStage.AWAITING_CALLBACK);
    assertThat(run.jobId()).isEqualTo("job-7");
    assertThat(PipelineStage.AWAITING_CALLBACK.canTransitionTo(PipelineStage.POLLING)).isFalse();
    assertThat(PipelineStage.AWAITING_CALLBACK.canTransitionTo(PipelineStage.FAILED)).isTrue();
  }
}
