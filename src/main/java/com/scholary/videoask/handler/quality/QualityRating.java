package com.scholary.videoask.handler.quality;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Acoustic quality rating derived from the average word confidence. */
public enum QualityRating {
  GOOD,
  FAIR,
  POOR;

  public static QualityRating fromConfidence(double overallConfidence) {
    if (overallConfidence > 0.9) {
      return GOOD;
    }
    if (overallConfidence > 0.8) {
      return FAIR;
    }
    return POOR;
  }

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
