package com.scholary.videoask.handler.service;

import java.util.List;

/** Submitted jobs and per-item failures of one form response. */
public record WebhookOutcome(List<SubmittedJob> jobs, List<ItemError> errors) {

  public WebhookOutcome {
    jobs = List.copyOf(jobs);
    errors = List.copyOf(errors);
  }
}
