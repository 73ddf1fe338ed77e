package com.scholary.videoask.handler.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.scholary.videoask.handler.job.TranscriptionJob;
import com.scholary.videoask.handler.quality.QualityReport;
import com.scholary.videoask.handler.service.ReconciledTranscript;

/**
 * Reply to a manual transcription request.
 *
 * <p>Without waiting only the job id and a message are returned. After a completed wait the
 * enhanced transcript, its quality metrics and the store outcome are included.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ManualTranscriptionResponse(
    String status,
    String jobId,
    String message,
    String transcript,
    QualityReport qualityMetrics,
    Boolean stored) {

  static ManualTranscriptionResponse submitted(TranscriptionJob job) {
    return new ManualTranscriptionResponse(
        job.status().label(),
        job.jobId(),
        "Transcription job submitted; the result is stored when the provider calls back",
        null,
        null,
        null);
  }

  static ManualTranscriptionResponse completed(ReconciledTranscript result) {
    return new ManualTranscriptionResponse(
        "completed",
        result.jobId(),
        null,
        result.transcript(),
        result.quality(),
        result.stored());
  }
}
