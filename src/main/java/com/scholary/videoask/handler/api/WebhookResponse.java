package com.scholary.videoask.handler.api;

import com.scholary.videoask.handler.service.ItemError;
import com.scholary.videoask.handler.service.SubmittedJob;
import com.scholary.videoask.handler.service.WebhookOutcome;
import java.util.List;

/** Reply to a form response. The status is always "processed"; failures are listed per item. */
public record WebhookResponse(String status, List<SubmittedJob> jobs, List<ItemError> errors) {

  static WebhookResponse from(WebhookOutcome outcome) {
    return new WebhookResponse("processed", outcome.jobs(), outcome.errors());
  }
}
