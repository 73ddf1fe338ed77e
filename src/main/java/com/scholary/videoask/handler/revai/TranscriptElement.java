package com.scholary.videoask.handler.revai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One element of a transcript: a word ({@code type = "text"}) or punctuation/whitespace
 * ({@code type = "punct"}).
 *
 * <p>Punctuation elements carry no timestamps or confidence.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptElement(
    String type, String value, Double ts, Double endTs, Double confidence) {

  public static TranscriptElement text(String value, double ts, double confidence) {
    return new TranscriptElement("text", value, ts, null, confidence);
  }

  public static TranscriptElement punct(String value) {
    return new TranscriptElement("punct", value, null, null, null);
  }

  public boolean isText() {
    return "text".equals(type);
  }

  public double confidenceOrZero() {
    return confidence == null ? 0.0 : confidence;
  }
}
