package com.scholary.videoask.handler.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request to transcribe a single media file outside the webhook flow.
 *
 * @param mediaUrl publicly reachable media URL
 * @param email contact email the transcript is stored under
 * @param question question label; defaults to "Manual request"
 * @param waitForCompletion block until the transcript is ready
 * @param maxWaitTime wait ceiling in seconds; defaults to the configured ceiling
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManualTranscriptionRequest(
    @NotBlank String mediaUrl,
    @NotBlank @Email String email,
    String question,
    Boolean waitForCompletion,
    @Positive Integer maxWaitTime) {

  public boolean shouldWait() {
    return Boolean.TRUE.equals(waitForCompletion);
  }
}
