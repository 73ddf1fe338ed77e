package com.scholary.videoask.handler.revai;

/** The provider reported a job as failed while we were waiting for it. */
public class JobFailedException extends RuntimeException {

  private final String jobId;
  private final String failureDetail;

  public JobFailedException(String jobId, String failureDetail) {
    super(String.format("Transcription job %s failed: %s", jobId, failureDetail));
    this.jobId = jobId;
    this.failureDetail = failureDetail;
  }

  public String getJobId() {
    return jobId;
  }

  public String getFailureDetail() {
    return failureDetail;
  }
}
