package com.scholary.videoask.handler.service;

import com.scholary.videoask.handler.job.JobStatus;

/**
 * Result of processing a provider callback.
 *
 * @param jobId provider job id; null when the payload could not be parsed
 * @param status provider status; null when the payload could not be parsed
 * @param stage the stage the run ended in
 * @param stored whether the result store accepted the transcript
 * @param error failure detail, if any
 */
public record CallbackOutcome(
    String jobId, JobStatus status, PipelineStage stage, boolean stored, String error) {}
