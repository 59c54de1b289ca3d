package com.flamingo.ai.contractqa.service.pipeline;

import com.flamingo.ai.contractqa.exception.PipelineCancelledException;
import com.flamingo.ai.contractqa.exception.StageTimeoutException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs external calls (embedding, generation, tools) on a dedicated executor and waits for them
 * with a per-operation time limit. A call that overruns is cancelled and reported as {@link
 * StageTimeoutException}; a call interrupted by its run's {@link CancellationToken} is reported as
 * {@link PipelineCancelledException}. Failures thrown by the call itself pass through unchanged.
 *
 * <p>The guard never retries.
 */
@Component
@Slf4j
public class ExternalCallGuard {

  public static final String EMBEDDING = "embedding";
  public static final String GENERATION = "generation";
  public static final String TOOL = "tool";

  private final TimeLimiterRegistry timeLimiterRegistry;
  private final AsyncTaskExecutor executor;

  public ExternalCallGuard(
      TimeLimiterRegistry timeLimiterRegistry,
      @Qualifier("externalCallExecutor") AsyncTaskExecutor executor) {
    this.timeLimiterRegistry = timeLimiterRegistry;
    this.executor = executor;
  }

  /**
   * Submits a call and waits for it.
   *
   * @param operation time limiter name, one of the operation constants
   * @param token the run's cancellation token
   * @param call the external call
   * @return the call's result
   */
  public <T> T call(String operation, CancellationToken token, Callable<T> call) {
    return await(operation, token, submit(token, call));
  }

  /** Starts a call without waiting, so several calls can run at once. */
  public <T> Future<T> submit(CancellationToken token, Callable<T> call) {
    token.throwIfCancelled();
    Future<T> future = executor.submit(call);
    token.track(future);
    return future;
  }

  /** Waits for a submitted call under the operation's time limit. */
  public <T> T await(String operation, CancellationToken token, Future<T> future) {
    TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(operation);
    try {
      return timeLimiter.executeFutureSupplier(() -> future);
    } catch (TimeoutException e) {
      if (token.isCancelled()) {
        throw new PipelineCancelledException();
      }
      log.warn(
          "{} call exceeded {} ms",
          operation,
          timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis());
      throw new StageTimeoutException(
          operation, timeLimiter.getTimeLimiterConfig().getTimeoutDuration(), e);
    } catch (CancellationException e) {
      throw new PipelineCancelledException();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new PipelineCancelledException();
    } catch (RuntimeException e) {
      if (token.isCancelled()) {
        throw new PipelineCancelledException();
      }
      throw e;
    } catch (Exception e) {
      if (token.isCancelled()) {
        throw new PipelineCancelledException();
      }
      throw new IllegalStateException(operation + " call failed: " + e.getMessage(), e);
    } finally {
      token.untrack(future);
    }
  }
}
