package com.scholary.videoask.handler.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Correlation metadata attached to a provider job.
 *
 * <p>Sent with the submission and echoed back by the provider on status lookups and callbacks, so
 * that a finished transcript can be matched to the contact and question it belongs to.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobMetadata(
    String email,
    String question,
    String interactionId,
    String answerId,
    String shareId,
    String answerType,
    String contactName) {

  public static JobMetadata of(String email, String question) {
    return new JobMetadata(email, question, null, null, null, null, null);
  }

  public static JobMetadata empty() {
    return new JobMetadata(null, null, null, null, null, null, null);
  }
}
