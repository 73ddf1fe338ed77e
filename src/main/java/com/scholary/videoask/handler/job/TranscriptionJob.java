package com.scholary.videoask.handler.job;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

/**
 * A submitted transcription job.
 *
 * <p>Created when the provider accepts a submission. The job is identified by the provider's job
 * id only; nothing is kept in memory once the request that created it has finished.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TranscriptionJob(
    String jobId,
    String mediaUrl,
    String contactEmail,
    String questionLabel,
    JobMetadata metadata,
    JobStatus status,
    Instant submittedAt) {}
