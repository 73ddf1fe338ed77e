package com.scholary.videoask.handler.revai;

import com.scholary.videoask.handler.job.JobMetadata;
import com.scholary.videoask.handler.job.JobStatus;

/** Status snapshot of a provider job. */
public record JobDetails(
    String id,
    JobStatus status,
    String mediaUrl,
    String createdOn,
    String failureDetail,
    JobMetadata metadata) {

  public JobDetails {
    metadata = metadata == null ? JobMetadata.empty() : metadata;
  }
}
