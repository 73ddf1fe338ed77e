package com.scholary.videoask.handler.revai;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videoask.handler.job.JobMetadata;
import java.time.Duration;

/**
 * Interface for the speech-to-text provider.
 *
 * <p>This abstraction keeps provider HTTP details and error mapping out of the pipeline and lets
 * the orchestrator be tested against a mock.
 */
public interface TranscriptionClient {

  /**
   * Submit a media file for transcription.
   *
   * @param mediaUrl publicly reachable media URL
   * @param metadata correlation metadata echoed back by the provider
   * @param options how completion will be detected
   * @return the provider's job handle
   * @throws com.scholary.videoask.handler.media.MediaValidationException if the format is not
   *     supported
   * @throws com.scholary.videoask.handler.config.ConfigurationException if no API key is
   *     configured or no completion path was requested
   * @throws ProviderException if the provider rejects the request or cannot be reached
   */
  JobHandle submit(String mediaUrl, JobMetadata metadata, SubmissionOptions options);

  /**
   * Fetch the current status of a job once.
   *
   * @throws ProviderException on transport or HTTP failure
   */
  JobDetails pollStatus(String jobId);

  /**
   * Fetch the transcript of a completed job.
   *
   * @throws ProviderException if the job has no transcript (yet) or the call fails
   */
  Transcript fetchTranscript(String jobId);

  /**
   * Parse a provider callback payload.
   *
   * @throws ProviderException if the payload carries no job id
   */
  CallbackEvent parseCallback(JsonNode payload);

  /**
   * Poll until the job is terminal or the wait ceiling elapses.
   *
   * @return details of the completed job
   * @throws JobFailedException if the provider reports the job as failed
   * @throws TranscriptionTimeoutException if the ceiling elapses first
   */
  JobDetails awaitCompletion(String jobId, Duration maxWait);
}
