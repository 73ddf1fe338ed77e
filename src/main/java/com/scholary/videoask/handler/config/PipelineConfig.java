package com.scholary.videoask.handler.config;

import com.scholary.videoask.handler.retry.RetryPolicy;
import com.scholary.videoask.handler.retry.Sleeper;
import com.scholary.videoask.handler.revai.ProviderException;
import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for pipeline infrastructure.
 *
 * <p>Provides the clock and sleeper used for waiting, and the retry policy applied around job
 * submission. Only provider failures are retried; validation and configuration errors fail
 * immediately.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public Sleeper sleeper() {
    return Sleeper.threadSleep();
  }

  @Bean
  public RetryPolicy submitRetryPolicy(PipelineProperties properties, Sleeper sleeper) {
    PipelineProperties.RetryProperties retry = properties.retry();
    return new RetryPolicy(
        retry.maxAttempts(),
        Duration.ofMillis(retry.initialBackoffMillis()),
        retry.multiplier(),
        e -> e instanceof ProviderException,
        sleeper);
  }
}
