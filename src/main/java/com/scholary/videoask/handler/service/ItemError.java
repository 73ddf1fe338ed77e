package com.scholary.videoask.handler.service;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** A media item that could not be submitted, with the reason. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ItemError(String mediaUrl, String error) {}
