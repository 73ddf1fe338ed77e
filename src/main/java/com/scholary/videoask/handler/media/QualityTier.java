package com.scholary.videoask.handler.media;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Coarse media quality bucket derived from the estimated bitrate. */
public enum QualityTier {
  HIGH,
  MEDIUM,
  LOW,
  UNKNOWN;

  @JsonValue
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
