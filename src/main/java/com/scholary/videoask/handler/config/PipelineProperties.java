package com.scholary.videoask.handler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the transcription pipeline.
 *
 * <p>Controls the submission retry schedule and the pool used to submit batch requests.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(
    @Valid @NotNull RetryProperties retry,
    @Positive int batchThreads,
    @Positive int batchQueueSize) {

  public record RetryProperties(
      @Positive int maxAttempts,
      @Positive long initialBackoffMillis,
      @Positive double multiplier) {}
}
