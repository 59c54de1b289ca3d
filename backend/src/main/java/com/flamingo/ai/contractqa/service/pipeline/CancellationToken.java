package com.flamingo.ai.contractqa.service.pipeline;

import com.flamingo.ai.contractqa.exception.PipelineCancelledException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag shared by one run and the external calls it has in flight. Cancelling
 * interrupts every tracked call; calls tracked after cancellation are cancelled immediately.
 */
public final class CancellationToken {

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

  /**
   * Cancels the run.
   *
   * @return true if this call cancelled it, false if it was already cancelled
   */
  public boolean cancel() {
    if (!cancelled.compareAndSet(false, true)) {
      return false;
    }
    for (Future<?> future : inFlight) {
      future.cancel(true);
    }
    return true;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void throwIfCancelled() {
    if (cancelled.get()) {
      throw new PipelineCancelledException();
    }
  }

  int inFlightCount() {
    return inFlight.size();
  }

  void track(Future<?> future) {
    inFlight.add(future);
    if (cancelled.get()) {
      future.cancel(true);
    }
  }

  void untrack(Future<?> future) {
    inFlight.remove(future);
  }
}
