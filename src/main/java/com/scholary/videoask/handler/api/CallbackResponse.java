package com.scholary.videoask.handler.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.scholary.videoask.handler.service.CallbackOutcome;
import java.util.Locale;

/** Reply to a provider callback. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CallbackResponse(
    String status, String jobId, boolean stored, String stage, String error) {

  static CallbackResponse from(CallbackOutcome outcome) {
    return new CallbackResponse(
        outcome.status() == null ? "error" : outcome.status().label(),
        outcome.jobId(),
        outcome.stored(),
        outcome.stage().name().toLowerCase(Locale.ROOT),
        outcome.error());
  }
}
