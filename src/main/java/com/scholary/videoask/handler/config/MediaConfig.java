package com.scholary.videoask.handler.config;

import com.scholary.videoask.handler.media.MediaProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for media validation and probing.
 *
 * <p>Enables the MediaProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(MediaProperties.class)
public class MediaConfig {}
