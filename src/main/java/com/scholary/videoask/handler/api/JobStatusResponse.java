package com.scholary.videoask.handler.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.scholary.videoask.handler.quality.QualityReport;
import com.scholary.videoask.handler.service.JobStatusView;

/** Response for job status queries. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    String jobId,
    String status,
    String createdOn,
    String failureDetail,
    String transcript,
    QualityReport qualityMetrics) {

  static JobStatusResponse from(JobStatusView view) {
    return new JobStatusResponse(
        view.jobId(),
        view.status().label(),
        view.createdOn(),
        view.failureDetail(),
        view.transcript(),
        view.quality());
  }
}
