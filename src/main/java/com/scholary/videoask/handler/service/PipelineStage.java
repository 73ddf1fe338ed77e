package com.scholary.videoask.handler.service;

import java.util.EnumSet;
import java.util.Set;

/**
 * Stages of one pipeline run.
 *
 * <pre>
 * RECEIVED -> VALIDATED -> SUBMITTED -> POLLING | AWAITING_CALLBACK -> RECONCILED -> STORED
 * </pre>
 *
 * <p>FAILED can be reached from every stage that is not terminal.
 */
public enum PipelineStage {
  RECEIVED,
  VALIDATED,
  SUBMITTED,
  POLLING,
  AWAITING_CALLBACK,
  RECONCILED,
  STORED,
  FAILED;

  public boolean isTerminal() {
    return this == STORED || this == FAILED;
  }

  public boolean canTransitionTo(PipelineStage next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return successors().contains(next);
  }

  private Set<PipelineStage> successors() {
    switch (this) {
      case RECEIVED:
        return EnumSet.of(VALIDATED);
      case VALIDATED:
        return EnumSet.of(SUBMITTED);
      case SUBMITTED:
        return EnumSet.of(POLLING, AWAITING_CALLBACK);
      case POLLING:
      case AWAITING_CALLBACK:
        return EnumSet.of(RECONCILED);
      case RECONCILED:
        return EnumSet.of(STORED);
      default:
        return EnumSet.noneOf(PipelineStage.class);
    }
  }
}
