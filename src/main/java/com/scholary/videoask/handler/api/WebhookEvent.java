package com.scholary.videoask.handler.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * A form response event from the survey platform.
 *
 * <p>Answers are read from the top level of the event, or from the contact when the top level has
 * none.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookEvent(
    String eventType,
    String interactionId,
    String shareId,
    Contact contact,
    List<WebhookAnswer> answers) {

  public WebhookEvent {
    answers = answers == null ? List.of() : answers;
  }

  @JsonIgnore
  public List<WebhookAnswer> mediaAnswers() {
    List<WebhookAnswer> source =
        !answers.isEmpty() || contact == null ? answers : contact.answers();
    return source.stream().filter(WebhookAnswer::hasMedia).toList();
  }

  @JsonIgnore
  public String contactEmail() {
    return contact == null ? null : contact.email();
  }

  @JsonIgnore
  public String contactName() {
    return contact == null ? null : contact.name();
  }
}
