package com.flamingo.ai.contractqa.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Enables {@code @Timed} on the pipeline entry points and tags every meter with the app name. */
@Configuration
public class MetricsConfig {

  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> applicationTag(
      @Value("${spring.application.name:contract-qa}") String applicationName) {
    return registry -> registry.config().commonTags("application", applicationName);
  }
}
