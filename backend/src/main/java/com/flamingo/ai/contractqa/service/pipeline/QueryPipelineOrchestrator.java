package com.flamingo.ai.contractqa.service.pipeline;

import com.flamingo.ai.contractqa.config.PipelineConfig;
import com.flamingo.ai.contractqa.domain.enums.QueryStage;
import com.flamingo.ai.contractqa.domain.model.CandidateAnswer;
import com.flamingo.ai.contractqa.domain.model.ContractAnswer;
import com.flamingo.ai.contractqa.domain.model.ContractQuery;
import com.flamingo.ai.contractqa.domain.model.EvidenceSet;
import com.flamingo.ai.contractqa.domain.model.ValidationResult;
import com.flamingo.ai.contractqa.exception.DocumentNotFoundException;
import com.flamingo.ai.contractqa.exception.DocumentNotIndexedException;
import com.flamingo.ai.contractqa.exception.PipelineException;
import com.flamingo.ai.contractqa.exception.SchemaValidationExhaustedException;
import com.flamingo.ai.contractqa.service.generation.EvidenceConstrainedGenerator;
import com.flamingo.ai.contractqa.service.generation.tool.ToolFinding;
import com.flamingo.ai.contractqa.service.index.EvidenceIndexRegistry;
import com.flamingo.ai.contractqa.service.index.EvidenceIndexSnapshot;
import com.flamingo.ai.contractqa.service.pipeline.QueryRunRegistry.QueryRun;
import com.flamingo.ai.contractqa.service.retrieval.ClauseRetriever;
import com.flamingo.ai.contractqa.service.validation.AnswerSchemaValidator;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs one question through retrieve, generate and validate.
 *
 * <p>Stages run strictly in sequence on the caller's thread. A rejected candidate sends the run
 * back to generation with the violations as feedback, at most {@code pipeline.repair.max-attempts}
 * times. Transient service failures are retried per stage by {@link ServiceRetryPolicy} and do not
 * count as repair attempts. Any other failure ends the run in {@link QueryStage#FAILED}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryPipelineOrchestrator {

  private final DocumentPipelineOrchestrator documentPipeline;
  private final EvidenceIndexRegistry indexRegistry;
  private final ClauseRetriever retriever;
  private final EvidenceConstrainedGenerator generator;
  private final AnswerSchemaValidator validator;
  private final QueryRunRegistry runRegistry;
  private final ServiceRetryPolicy retryPolicy;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Answers a question about an indexed document.
   *
   * @param documentId document to query
   * @param query the question
   * @param runId caller-chosen run id for status and cancellation, or null to generate one
   * @return the validated answer
   * @throws DocumentNotFoundException if the document was never ingested
   * @throws DocumentNotIndexedException if the document has no published index yet
   * @throws PipelineException if the run failed
   */
  @Timed(value = "pipeline.query", description = "Time to answer a query end to end")
  public QueryResult answer(String documentId, ContractQuery query, String runId) {
    EvidenceIndexSnapshot snapshot =
        indexRegistry
            .find(documentId)
            .orElseThrow(
                () ->
                    documentPipeline.find(documentId).isPresent()
                        ? new DocumentNotIndexedException(documentId)
                        : new DocumentNotFoundException(documentId));

    String id = runId == null || runId.isBlank() ? UUID.randomUUID().toString() : runId;
    QueryRun run = runRegistry.register(id);
    RunState<QueryStage> state = run.state();
    CancellationToken token = run.token();

    try {
      state.transitionTo(QueryStage.RETRIEVING);
      EvidenceSet evidence =
          retryPolicy.execute(
              "retrieval", state, token, () -> retriever.retrieve(snapshot, query, token));

      if (evidence.isEmpty()) {
        state.transitionTo(QueryStage.DONE);
        meterRegistry.counter("pipeline.query.completed", "outcome", "no_evidence").increment();
        log.info("Run {}: no evidence in document {}, returning empty answer", id, documentId);
        return new QueryResult(ContractAnswer.noEvidence(), evidence, state.view());
      }

      ContractAnswer answer = generateValidAnswer(query, evidence, state, token);
      state.transitionTo(QueryStage.DONE);
      meterRegistry.counter("pipeline.query.completed", "outcome", "answered").increment();
      log.info(
          "Run {}: answered from {} clauses after {} attempt(s), {} service retries",
          id,
          evidence.size(),
          state.getAttemptCount(),
          state.getServiceRetryCount());
      return new QueryResult(answer, evidence, state.view());
    } catch (PipelineException e) {
      e.atStage(state.getStage().name());
      state.fail(e.getKind());
      meterRegistry.counter("pipeline.query.failed", "kind", e.getKind().name()).increment();
      log.error("Run {} failed at {}: {}", id, e.getStage(), e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      state.fail(null);
      meterRegistry.counter("pipeline.query.failed", "kind", "UNEXPECTED").increment();
      log.error("Run {} failed unexpectedly at {}", id, state.getStage(), e);
      throw e;
    } finally {
      runRegistry.remove(id);
    }
  }

  private ContractAnswer generateValidAnswer(
      ContractQuery query,
      EvidenceSet evidence,
      RunState<QueryStage> state,
      CancellationToken token) {
    int maxAttempts = Math.max(1, pipelineConfig.getRepair().getMaxAttempts());
    List<String> feedback = List.of();
    List<ToolFinding> findings = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      token.throwIfCancelled();
      state.transitionTo(QueryStage.GENERATING);
      state.recordGenerationAttempt();
      if (findings == null) {
        // tools run once per query; repairs and retries reuse the findings
        findings = generator.collectFindings(evidence, token);
      }

      List<String> attemptFeedback = feedback;
      List<ToolFinding> attemptFindings = findings;
      CandidateAnswer candidate =
          retryPolicy.execute(
              "generation",
              state,
              token,
              () -> generator.generate(query, evidence, attemptFindings, attemptFeedback, token));

      state.transitionTo(QueryStage.VALIDATING);
      ValidationResult result = validator.validate(candidate, evidence);
      if (result.valid()) {
        meterRegistry.counter("validation.accepted").increment();
        return result.answer();
      }

      meterRegistry.counter("validation.rejected").increment();
      log.warn(
          "Run {}: attempt {}/{} rejected: {}",
          state.getRunId(),
          attempt,
          maxAttempts,
          result.violations());
      feedback = result.violations();
    }

    throw new SchemaValidationExhaustedException(maxAttempts, feedback);
  }
}
