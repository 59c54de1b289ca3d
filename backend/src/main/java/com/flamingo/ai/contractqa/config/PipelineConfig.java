package com.flamingo.ai.contractqa.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the contract QA pipeline. */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
public class PipelineConfig {

  private Segmentation segmentation = new Segmentation();
  private Retrieval retrieval = new Retrieval();
  private Repair repair = new Repair();
  private Retry retry = new Retry();
  private Timeouts timeouts = new Timeouts();
  private Tools tools = new Tools();

  @Getter
  @Setter
  public static class Segmentation {
    /** Maximum characters of trimmed clause text. */
    private int maxUnitLength = 1000;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 5;
    private int maxTopK = 50;
  }

  @Getter
  @Setter
  public static class Repair {
    /** Maximum generator invocations per query before giving up on schema validation. */
    private int maxAttempts = 3;
  }

  /** Orchestrator-level retry of transient external-service failures. */
  @Getter
  @Setter
  public static class Retry {
    private int maxAttempts = 3;
    private Duration wait = Duration.ofMillis(500);
  }

  @Getter
  @Setter
  public static class Timeouts {
    private Duration embedding = Duration.ofSeconds(30);
    private Duration generation = Duration.ofSeconds(60);
    private Duration tool = Duration.ofSeconds(10);
  }

  @Getter
  @Setter
  public static class Tools {
    /** Whether auxiliary clause tools run before generation. */
    private boolean enabled = true;
  }
}
