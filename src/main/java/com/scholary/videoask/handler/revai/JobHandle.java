package com.scholary.videoask.handler.revai;

import com.scholary.videoask.handler.job.JobStatus;
import java.time.Instant;

/** Provider acknowledgement of a submitted job. */
public record JobHandle(String jobId, JobStatus status, Instant submittedAt) {}
