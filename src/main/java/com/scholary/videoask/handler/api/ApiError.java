package com.scholary.videoask.handler.api;

import java.time.Instant;

/** Structured error body returned by the single-item endpoints. */
public record ApiError(String errorCode, String message, String details, Instant timestamp) {}
