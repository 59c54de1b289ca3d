package com.flamingo.ai.contractqa.api.rest;

import com.flamingo.ai.contractqa.service.pipeline.QueryRunRegistry;
import com.flamingo.ai.contractqa.service.pipeline.RunStateView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for in-flight query runs. Finished runs are no longer visible here. */
@RestController
@RequestMapping("/api/queries")
@RequiredArgsConstructor
public class QueryRunController {

  private final QueryRunRegistry runRegistry;

  /** Gets the state of an in-flight run. */
  @GetMapping("/{runId}")
  public ResponseEntity<RunStateView> getRun(@PathVariable String runId) {
    return runRegistry
        .find(runId)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  /** Cancels an in-flight run. The run itself fails with a cancellation error. */
  @DeleteMapping("/{runId}")
  public ResponseEntity<Void> cancelRun(@PathVariable String runId) {
    if (!runRegistry.cancel(runId)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.accepted().build();
  }
}
