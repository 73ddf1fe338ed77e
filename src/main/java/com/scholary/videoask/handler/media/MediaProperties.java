package com.scholary.videoask.handler.media;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for media handling.
 *
 * <p>The supported formats are file extensions (lowercase, without the dot). The probe settings
 * control the HEAD request used to estimate media quality and the cache that sits in front of it.
 */
@ConfigurationProperties(prefix = "media")
@Validated
public record MediaProperties(
    @NotEmpty Set<String> supportedFormats,
    @Positive int probeTimeout,
    @Positive int probeCacheSize,
    @Positive int probeCacheExpireAfterMinutes) {}
