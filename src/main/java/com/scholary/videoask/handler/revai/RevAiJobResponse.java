package com.scholary.videoask.handler.revai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Job object as the provider returns it from {@code POST /jobs}, {@code GET /jobs/{id}} and inside
 * callback envelopes.
 *
 * <p>{@code metadata} is a free-form string on the provider side; we store our correlation
 * metadata in it as JSON. It is kept as a raw node here and decoded by the client.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
record RevAiJobResponse(
    String id,
    String status,
    String mediaUrl,
    String createdOn,
    String failureDetail,
    String failure,
    JsonNode metadata,
    Transcript transcript) {}
