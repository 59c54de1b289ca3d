package com.flamingo.ai.contractqa.service.retrieval;

import com.flamingo.ai.contractqa.domain.model.ContractQuery;
import com.flamingo.ai.contractqa.domain.model.EvidenceSet;
import com.flamingo.ai.contractqa.service.embedding.EmbeddingService;
import com.flamingo.ai.contractqa.service.index.EvidenceIndexService;
import com.flamingo.ai.contractqa.service.index.EvidenceIndexSnapshot;
import com.flamingo.ai.contractqa.service.pipeline.CancellationToken;
import com.flamingo.ai.contractqa.service.pipeline.ExternalCallGuard;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Embeds a question and looks up the closest clauses. Embedding failures propagate to the caller
 * untouched; this class never retries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClauseRetriever {

  private final EmbeddingService embeddingService;
  private final EvidenceIndexService indexService;
  private final ExternalCallGuard guard;
  private final MeterRegistry meterRegistry;

  @Timed(value = "retrieval.retrieve", description = "Time to retrieve evidence for a query")
  public EvidenceSet retrieve(
      EvidenceIndexSnapshot snapshot, ContractQuery query, CancellationToken token) {
    if (snapshot.isEmpty()) {
      log.debug("Index for document {} is empty, no evidence", snapshot.getDocumentId());
      meterRegistry.counter("retrieval.empty_index").increment();
      return EvidenceSet.empty();
    }

    float[] queryVector =
        guard.call(
            ExternalCallGuard.EMBEDDING, token, () -> embeddingService.embedQuery(query.text()));
    EvidenceSet evidence = indexService.query(snapshot, queryVector, query.topK());

    meterRegistry.summary("retrieval.evidence.size").record(evidence.size());
    log.debug(
        "Retrieved {} of {} clauses for document {}: {}",
        evidence.size(),
        snapshot.size(),
        snapshot.getDocumentId(),
        evidence.unitIds());
    return evidence;
  }
}
