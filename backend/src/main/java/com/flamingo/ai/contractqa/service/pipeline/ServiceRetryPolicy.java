package com.flamingo.ai.contractqa.service.pipeline;

import io.github.resilience4j.retry.Retry;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies the orchestrators' retry policy to one pipeline step. Only transient failures are
 * retried; each retry is counted on the run and is skipped once the run is cancelled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ServiceRetryPolicy {

  private final Retry pipelineRetry;

  public <T> T execute(
      String step, RunState<?> state, CancellationToken token, Supplier<T> call) {
    AtomicInteger calls = new AtomicInteger();
    Supplier<T> counted =
        () -> {
          if (calls.getAndIncrement() > 0) {
            token.throwIfCancelled();
            int retries = state.recordServiceRetry();
            log.warn(
                "Retrying {} for run {} (service retry #{})", step, state.getRunId(), retries);
          }
          return call.get();
        };
    return Retry.decorateSupplier(pipelineRetry, counted).get();
  }
}
