package com.scholary.videoask.handler.revai;

/**
 * How completion of a submitted job will be detected.
 *
 * <p>At least one path must be present: a callback URL the provider notifies, or a synchronous
 * wait by the caller.
 */
public record SubmissionOptions(String callbackUrl, boolean waitForCompletion) {

  public static SubmissionOptions callback(String callbackUrl) {
    return new SubmissionOptions(callbackUrl, false);
  }

  public static SubmissionOptions waitFor(String callbackUrl) {
    return new SubmissionOptions(callbackUrl, true);
  }

  public boolean hasCallback() {
    return callbackUrl != null && !callbackUrl.isBlank();
  }
}
