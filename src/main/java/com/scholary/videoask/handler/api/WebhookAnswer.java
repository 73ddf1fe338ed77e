package com.scholary.videoask.handler.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** One answer of a form response. Only answers with a media URL are transcribed. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WebhookAnswer(
    String answerId, String mediaUrl, String type, String pollOptionContent, String shareId) {

  @JsonIgnore
  public boolean hasMedia() {
    return mediaUrl != null && !mediaUrl.isBlank();
  }
}
