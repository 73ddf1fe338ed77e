package com.scholary.videoask.handler.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** The respondent of a form response. Some event types nest the answers here. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Contact(String email, String name, List<WebhookAnswer> answers) {

  public Contact {
    answers = answers == null ? List.of() : answers;
  }
}
