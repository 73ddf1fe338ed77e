package com.scholary.videoask.handler.service;

import com.scholary.videoask.handler.job.JobStatus;
import com.scholary.videoask.handler.quality.QualityReport;

/** Read-only view of a provider job; transcript and quality are present once completed. */
public record JobStatusView(
    String jobId,
    JobStatus status,
    String createdOn,
    String failureDetail,
    String transcript,
    QualityReport quality) {}
