package com.scholary.videoask.handler.revai;

import java.time.Duration;

/** The wait ceiling elapsed before the job reached a terminal status. */
public class TranscriptionTimeoutException extends RuntimeException {

  private final String jobId;
  private final Duration maxWait;

  public TranscriptionTimeoutException(String jobId, Duration maxWait) {
    super(
        String.format(
            "Transcription job %s did not complete within %d seconds",
            jobId, maxWait.getSeconds()));
    this.jobId = jobId;
    this.maxWait = maxWait;
  }

  public String getJobId() {
    return jobId;
  }

  public Duration getMaxWait() {
    return maxWait;
  }
}
