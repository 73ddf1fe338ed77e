package com.scholary.videoask.handler.revai;

import com.scholary.videoask.handler.job.JobMetadata;
import com.scholary.videoask.handler.job.JobStatus;
import java.util.Optional;

/**
 * A parsed provider push notification.
 *
 * <p>The provider may include the finished transcript in the notification. When it does, the
 * embedded transcript is used; otherwise it has to be fetched separately.
 */
public record CallbackEvent(
    String jobId,
    JobStatus status,
    String mediaUrl,
    String failureDetail,
    JobMetadata metadata,
    Transcript embeddedTranscript) {

  public Optional<Transcript> transcript() {
    return Optional.ofNullable(embeddedTranscript);
  }

  public JobDetails toJobDetails() {
    return new JobDetails(jobId, status, mediaUrl, null, failureDetail, metadata);
  }
}
