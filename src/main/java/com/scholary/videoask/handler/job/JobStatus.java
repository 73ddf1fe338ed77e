package com.scholary.videoask.handler.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Provider-side state of a transcription job.
 *
 * <p>Transitions are driven by the provider and observed through polling or callbacks. COMPLETED
 * and FAILED are terminal.
 */
public enum JobStatus {
  PENDING,
  IN_PROGRESS,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Map a provider status string.
   *
   * <p>The provider reports finished jobs as {@code transcribed}; {@code completed} is accepted as
   * well. Unknown or missing values are treated as PENDING.
   */
  public static JobStatus fromProvider(String status) {
    if (status == null) {
      return PENDING;
    }
    return switch (status.trim().toLowerCase(Locale.ROOT)) {
      case "in_progress", "processing" -> IN_PROGRESS;
      case "transcribed", "completed" -> COMPLETED;
      case "failed" -> FAILED;
      default -> PENDING;
    };
  }
}
