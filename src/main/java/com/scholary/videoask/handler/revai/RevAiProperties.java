package com.scholary.videoask.handler.revai;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Rev.ai speech-to-text client.
 *
 * <p>The API key and callback URL are optional at startup. A missing key is reported on each
 * submission instead, so that webhook deliveries are still acknowledged.
 */
@ConfigurationProperties(prefix = "revai")
@Validated
public record RevAiProperties(
    @NotBlank String baseUrl,
    String apiKey,
    String callbackUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int pollIntervalSeconds,
    @Positive int defaultMaxWaitSeconds) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }

  public boolean hasCallbackUrl() {
    return callbackUrl != null && !callbackUrl.isBlank();
  }
}
