package com.scholary.videoask.handler.quality;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.scholary.videoask.handler.job.JobStatus;
import com.scholary.videoask.handler.media.MediaQualityReport;
import com.scholary.videoask.handler.media.QualityTier;
import com.scholary.videoask.handler.nlp.EnhancedTranscript;
import com.scholary.videoask.handler.nlp.LinguisticAnalysis;
import java.util.List;

/**
 * Quality metrics for one transcript.
 *
 * <p>Derived on demand and never stored on its own; a stored transcript carries a summary of it.
 * Reports for jobs that have not completed only carry the status, a message and the media
 * sub-report. The linguistic fields are filled in by {@link #withLinguistics} once the text has
 * been analysed.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QualityReport(
    JobStatus status,
    String message,
    Double overallConfidence,
    Integer totalWords,
    Integer lowConfidenceCount,
    List<LowConfidenceWord> lowConfidenceWords,
    QualityRating qualityRating,
    QualityTier mediaQualityTier,
    MediaQualityReport mediaQuality,
    Double linguisticQualityScore,
    List<String> enhancementWarnings,
    LinguisticAnalysis linguisticAnalysis,
    List<String> warnings) {

  static QualityReport incomplete(JobStatus status, MediaQualityReport mediaQuality) {
    return new QualityReport(
        status,
        "Transcript not ready yet",
        null,
        null,
        null,
        null,
        null,
        mediaQuality.tier(),
        mediaQuality,
        null,
        null,
        null,
        null);
  }

  @JsonIgnore
  public boolean isComplete() {
    return status == JobStatus.COMPLETED && overallConfidence != null;
  }

  /** Merge the linguistic results into this acoustic report. */
  public QualityReport withLinguistics(EnhancedTranscript enhanced) {
    return new QualityReport(
        status,
        message,
        overallConfidence,
        totalWords,
        lowConfidenceCount,
        lowConfidenceWords,
        qualityRating,
        mediaQualityTier,
        mediaQuality,
        enhanced.qualityScore(),
        enhanced.enhancementWarnings(),
        enhanced.linguisticAnalysis(),
        warnings);
  }
}
