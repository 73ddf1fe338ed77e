package com.scholary.videoask.handler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for batch submission.
 *
 * <p>Sets up a bounded thread pool so that the items of one batch request are submitted in
 * parallel. The pool size and queue capacity are configurable to control load on the provider.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "batchExecutor")
  public ThreadPoolTaskExecutor batchExecutor(PipelineProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.batchThreads());
    executor.setMaxPoolSize(properties.batchThreads());
    executor.setQueueCapacity(properties.batchQueueSize());
    executor.setThreadNamePrefix("batch-submit-");
    executor.initialize();
    return executor;
  }
}
