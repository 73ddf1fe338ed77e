package com.scholary.videoask.handler.media;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Result of probing a media file.
 *
 * <p>The bitrate is an estimate built on a fixed-duration assumption, so the tier is indicative
 * only. Fields that could not be determined are left null and omitted from JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MediaQualityReport(
    QualityTier tier,
    String mediaType,
    String format,
    Double estimatedBitrateKbps,
    String recommendedMinimumBitrate,
    List<String> warnings,
    String error) {

  public MediaQualityReport {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public static MediaQualityReport unknown(String warning) {
    return new MediaQualityReport(
        QualityTier.UNKNOWN, null, null, null, null, List.of(warning), null);
  }

  public static MediaQualityReport failed(String error) {
    return new MediaQualityReport(
        QualityTier.UNKNOWN,
        null,
        null,
        null,
        null,
        List.of("Could not analyze media quality"),
        error);
  }
}
