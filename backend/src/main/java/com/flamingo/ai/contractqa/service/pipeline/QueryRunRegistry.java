package com.flamingo.ai.contractqa.service.pipeline;

import com.flamingo.ai.contractqa.domain.enums.QueryStage;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** In-flight query runs by run id. Runs are removed once they reach a terminal stage. */
@Component
@Slf4j
public class QueryRunRegistry {

  private final Map<String, QueryRun> runs = new ConcurrentHashMap<>();

  public QueryRunRegistry(MeterRegistry meterRegistry) {
    meterRegistry.gauge("pipeline.query.inflight", runs, Map::size);
  }

  /**
   * Registers a new run.
   *
   * @throws IllegalArgumentException if a run with the same id is already in flight
   */
  public QueryRun register(String runId) {
    QueryRun run = new QueryRun(RunState.forQuery(runId), new CancellationToken());
    if (runs.putIfAbsent(runId, run) != null) {
      throw new IllegalArgumentException("Run already in flight: " + runId);
    }
    return run;
  }

  public Optional<RunStateView> find(String runId) {
    return Optional.ofNullable(runs.get(runId)).map(run -> run.state().view());
  }

  /**
   * Requests cancellation of an in-flight run.
   *
   * @return false if no run with that id is in flight
   */
  public boolean cancel(String runId) {
    QueryRun run = runs.get(runId);
    if (run == null) {
      return false;
    }
    if (run.token().cancel()) {
      log.info("Cancellation requested for run {} at stage {}", runId, run.state().getStage());
    }
    return true;
  }

  public void remove(String runId) {
    runs.remove(runId);
  }

  /** State and cancellation token of one in-flight query. */
  public record QueryRun(RunState<QueryStage> state, CancellationToken token) {}
}
