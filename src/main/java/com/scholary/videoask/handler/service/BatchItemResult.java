package com.scholary.videoask.handler.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Outcome of one batch item: "submitted" with a job id, or "failed" with an error. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BatchItemResult(String mediaUrl, String jobId, String status, String error) {

  static final String SUBMITTED = "submitted";
  static final String FAILED = "failed";

  static BatchItemResult submitted(String mediaUrl, String jobId) {
    return new BatchItemResult(mediaUrl, jobId, SUBMITTED, null);
  }

  static BatchItemResult failed(String mediaUrl, String error) {
    return new BatchItemResult(mediaUrl, null, FAILED, error);
  }

  @JsonIgnore
  public boolean isFailed() {
    return FAILED.equals(status);
  }
}
