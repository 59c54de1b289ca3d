package com.flamingo.ai.contractqa.config;

import com.flamingo.ai.contractqa.exception.PipelineException;
import com.flamingo.ai.contractqa.service.pipeline.ExternalCallGuard;
import io.github.resilience4j.micrometer.tagged.TaggedRetryMetrics;
import io.github.resilience4j.micrometer.tagged.TaggedTimeLimiterMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resilience4j wiring. Time limits apply to every external call; the retry is used only by the
 * orchestrators, never by individual components.
 */
@Configuration
public class ResilienceConfig {

  public static final String PIPELINE_RETRY = "pipeline-service";

  @Bean
  public TimeLimiterRegistry timeLimiterRegistry(
      PipelineConfig pipelineConfig, MeterRegistry meterRegistry) {
    PipelineConfig.Timeouts timeouts = pipelineConfig.getTimeouts();
    TimeLimiterRegistry registry = TimeLimiterRegistry.of(timeLimit(timeouts.getGeneration()));
    registry.timeLimiter(ExternalCallGuard.EMBEDDING, timeLimit(timeouts.getEmbedding()));
    registry.timeLimiter(ExternalCallGuard.GENERATION, timeLimit(timeouts.getGeneration()));
    registry.timeLimiter(ExternalCallGuard.TOOL, timeLimit(timeouts.getTool()));
    TaggedTimeLimiterMetrics.ofTimeLimiterRegistry(registry).bindTo(meterRegistry);
    return registry;
  }

  @Bean
  public RetryRegistry retryRegistry(MeterRegistry meterRegistry) {
    RetryRegistry registry = RetryRegistry.ofDefaults();
    TaggedRetryMetrics.ofRetryRegistry(registry).bindTo(meterRegistry);
    return registry;
  }

  /** Bounded retry of transient embedding, generation and timeout failures. */
  @Bean
  public Retry pipelineRetry(RetryRegistry retryRegistry, PipelineConfig pipelineConfig) {
    return retryRegistry.retry(PIPELINE_RETRY, serviceRetryConfig(pipelineConfig.getRetry()));
  }

  public static RetryConfig serviceRetryConfig(PipelineConfig.Retry retry) {
    return RetryConfig.custom()
        .maxAttempts(retry.getMaxAttempts())
        .waitDuration(retry.getWait())
        .retryOnException(ResilienceConfig::isRetryable)
        .build();
  }

  private static boolean isRetryable(Throwable throwable) {
    return throwable instanceof PipelineException pipelineException
        && pipelineException.isRetryable();
  }

  private static TimeLimiterConfig timeLimit(Duration timeout) {
    return TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build();
  }
}
