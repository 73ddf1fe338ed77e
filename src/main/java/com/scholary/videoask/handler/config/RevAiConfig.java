package com.scholary.videoask.handler.config;

import com.scholary.videoask.handler.revai.RevAiProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Rev.ai client.
 *
 * <p>Enables the RevAiProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(RevAiProperties.class)
public class RevAiConfig {}
