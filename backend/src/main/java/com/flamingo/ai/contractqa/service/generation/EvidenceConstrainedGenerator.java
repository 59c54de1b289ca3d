package com.flamingo.ai.contractqa.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contractqa.agent.ContractAnswerAgent;
import com.flamingo.ai.contractqa.config.PipelineConfig;
import com.flamingo.ai.contractqa.domain.model.CandidateAnswer;
import com.flamingo.ai.contractqa.domain.model.ContractQuery;
import com.flamingo.ai.contractqa.domain.model.EvidenceItem;
import com.flamingo.ai.contractqa.domain.model.EvidenceSet;
import com.flamingo.ai.contractqa.exception.GenerationServiceException;
import com.flamingo.ai.contractqa.exception.PipelineCancelledException;
import com.flamingo.ai.contractqa.exception.PipelineException;
import com.flamingo.ai.contractqa.service.generation.tool.ClauseTool;
import com.flamingo.ai.contractqa.service.generation.tool.ToolFinding;
import com.flamingo.ai.contractqa.service.pipeline.CancellationToken;
import com.flamingo.ai.contractqa.service.pipeline.ExternalCallGuard;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Produces a candidate answer from the retrieved clauses only.
 *
 * <p>Tool findings are collected once per query by {@link #collectFindings}, which runs every tool
 * on every evidence clause in parallel, and are then reused by every generation attempt. Tool
 * failures, timeouts and rejected submissions drop the finding and never stop generation. The
 * model's output is returned as an
 * untrusted {@link CandidateAnswer}; output that is not JSON is left for the validator to reject.
 * Only a failed or empty model call is a {@link GenerationServiceException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EvidenceConstrainedGenerator {

  static final String NONE = "(none)";

  private final ContractAnswerAgent answerAgent;
  private final List<ClauseTool<?>> tools;
  private final ExternalCallGuard guard;
  private final PipelineConfig pipelineConfig;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  /**
   * Runs the tools over the evidence. Returns an empty list when tools are disabled.
   *
   * @param evidence clauses to run the tools on
   * @param token cancellation token of the run
   * @return findings of the tools that succeeded with a non-null result
   */
  @Timed(value = "generation.tools", description = "Time to run tools over the evidence")
  public List<ToolFinding> collectFindings(EvidenceSet evidence, CancellationToken token) {
    if (!pipelineConfig.getTools().isEnabled() || tools.isEmpty()) {
      return List.of();
    }
    return runTools(evidence, token);
  }

  /**
   * Generates one candidate answer.
   *
   * @param query the question
   * @param evidence clauses the answer may rely on
   * @param findings tool findings from {@link #collectFindings}
   * @param feedback violations of the previous attempt, empty on the first attempt
   * @param token cancellation token of the run
   * @return the untrusted candidate
   */
  @Timed(value = "generation.generate", description = "Time to generate a candidate answer")
  public CandidateAnswer generate(
      ContractQuery query,
      EvidenceSet evidence,
      List<ToolFinding> findings,
      List<String> feedback,
      CancellationToken token) {
    String evidenceBlock = formatEvidence(evidence);
    String findingsBlock = formatFindings(findings);
    String feedbackBlock = formatFeedback(feedback);

    String rawOutput;
    try {
      rawOutput =
          guard.call(
              ExternalCallGuard.GENERATION,
              token,
              () -> answerAgent.answer(query.text(), evidenceBlock, findingsBlock, feedbackBlock));
    } catch (PipelineException e) {
      meterRegistry.counter("generation.requests.failure", "kind", e.getKind().name()).increment();
      throw e;
    } catch (RuntimeException e) {
      meterRegistry.counter("generation.requests.failure", "kind", "service").increment();
      throw new GenerationServiceException("Generation request failed: " + e.getMessage(), e);
    }

    if (rawOutput == null || rawOutput.isBlank()) {
      meterRegistry.counter("generation.requests.failure", "kind", "empty").increment();
      throw new GenerationServiceException("Generation service returned no output");
    }

    meterRegistry.counter("generation.requests.success").increment();
    log.debug(
        "Generated candidate ({} chars) from {} clauses, {} tool findings, {} feedback items",
        rawOutput.length(),
        evidence.size(),
        findings.size(),
        feedback.size());
    return CandidateAnswer.fromRawOutput(rawOutput.strip(), objectMapper);
  }

  // ---- tools ----

  private List<ToolFinding> runTools(EvidenceSet evidence, CancellationToken token) {
    List<PendingCall> pending = new ArrayList<>();
    List<ToolFinding> findings = new ArrayList<>();
    try {
      for (EvidenceItem item : evidence.items()) {
        for (ClauseTool<?> tool : tools) {
          try {
            pending.add(
                new PendingCall(
                    tool.name(),
                    item.unitId(),
                    guard.submit(token, () -> tool.apply(item.text()))));
          } catch (PipelineCancelledException e) {
            throw e;
          } catch (RuntimeException e) {
            // a saturated executor rejects the submission
            recordToolFailure(tool.name(), item.unitId(), e);
          }
        }
      }
      for (PendingCall call : pending) {
        try {
          Object value = guard.await(ExternalCallGuard.TOOL, token, call.future());
          if (value != null) {
            findings.add(new ToolFinding(call.tool(), call.unitId(), value));
          }
        } catch (PipelineCancelledException e) {
          throw e;
        } catch (RuntimeException e) {
          recordToolFailure(call.tool(), call.unitId(), e);
        }
      }
    } finally {
      pending.forEach(call -> call.future().cancel(true));
    }
    log.debug("Tools produced {} findings over {} clauses", findings.size(), evidence.size());
    return findings;
  }

  private void recordToolFailure(String tool, String unitId, RuntimeException e) {
    meterRegistry.counter("tools.failure", "tool", tool).increment();
    log.warn("Tool {} failed on {}, continuing without it: {}", tool, unitId, e.getMessage());
  }

  // ---- prompt blocks ----

  private String formatEvidence(EvidenceSet evidence) {
    StringBuilder sb = new StringBuilder();
    for (EvidenceItem item : evidence.items()) {
      sb.append('[').append(item.unitId()).append("] ").append(item.text()).append("\n\n");
    }
    return sb.toString().strip();
  }

  private String formatFindings(List<ToolFinding> findings) {
    if (findings.isEmpty()) {
      return NONE;
    }
    StringBuilder sb = new StringBuilder();
    for (ToolFinding finding : findings) {
      sb.append("- [")
          .append(finding.unitId())
          .append("] ")
          .append(finding.tool())
          .append(": ")
          .append(render(finding.value()))
          .append('\n');
    }
    return sb.toString().strip();
  }

  private String formatFeedback(List<String> feedback) {
    if (feedback.isEmpty()) {
      return NONE;
    }
    StringBuilder sb = new StringBuilder("Your previous answer was rejected:\n");
    for (String violation : feedback) {
      sb.append("- ").append(violation).append('\n');
    }
    return sb.toString().strip();
  }

  private String render(Object value) {
    if (value instanceof Enum<?> constant) {
      return constant.name();
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      log.debug("Rendering tool finding as text: {}", e.getMessage());
      return String.valueOf(value);
    }
  }

  private record PendingCall(String tool, String unitId, Future<?> future) {}
}
