package com.flamingo.ai.contractqa.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for background document builds and guarded external calls. */
@Configuration
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public ThreadPoolTaskExecutor documentProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("doc-build-");
    executor.initialize();
    return executor;
  }

  /** Runs embedding, generation and tool calls so callers can wait on them with a time limit. */
  @Bean(name = "externalCallExecutor")
  public ThreadPoolTaskExecutor externalCallExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(16);
    executor.setMaxPoolSize(64);
    executor.setQueueCapacity(500);
    executor.setThreadNamePrefix("ext-call-");
    executor.initialize();
    return executor;
  }
}
