package com.flamingo.ai.contractqa.service.generation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.ai.contractqa.agent.ContractAnswerAgent;
import com.flamingo.ai.contractqa.config.PipelineConfig;
import com.flamingo.ai.contractqa.domain.model.CandidateAnswer;
import com.flamingo.ai.contractqa.domain.model.ContractQuery;
import com.flamingo.ai.contractqa.domain.model.EvidenceItem;
import com.flamingo.ai.contractqa.domain.model.EvidenceSet;
import com.flamingo.ai.contractqa.exception.GenerationServiceException;
import com.flamingo.ai.contractqa.exception.PipelineException;
import com.flamingo.ai.contractqa.exception.StageTimeoutException;
import com.flamingo.ai.contractqa.service.generation.tool.ClauseTool;
import com.flamingo.ai.contractqa.service.generation.tool.DateNormalizationTool;
import com.flamingo.ai.contractqa.service.generation.tool.DeadlineCalculationTool;
import com.flamingo.ai.contractqa.service.generation.tool.ToolFinding;
import com.flamingo.ai.contractqa.service.pipeline.CancellationToken;
import com.flamingo.ai.contractqa.service.pipeline.ExternalCallGuard;
import com.flamingo.ai.contractqa.support.PipelineFixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
@DisplayName("EvidenceConstrainedGenerator Tests")
class EvidenceConstrainedGeneratorTest {

  private static final String VALID_JSON =
      "{\"summary\":\"s\",\"obligations\":[],\"penalties\":[],\"risks\":[],"
          + "\"supporting_clauses\":[]}";

  @Mock private ContractAnswerAgent answerAgent;

  private final ObjectMapper objectMapper =
      JsonMapper.builder()
          .findAndAddModules()
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .build();

  private SimpleMeterRegistry meterRegistry;
  private PipelineConfig config;
  private ContractQuery query;
  private EvidenceSet evidence;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    config = PipelineFixtures.config();
    query = new ContractQuery(PipelineFixtures.LATE_PAYMENT_QUESTION, 2);
    evidence =
        EvidenceSet.of(
            List.of(
                new EvidenceItem(
                    PipelineFixtures.clauseId(2), 2, "1.5% monthly penalty after due date", 0.9),
                new EvidenceItem(
                    PipelineFixtures.clauseId(1),
                    1,
                    "Payment due within 30 days of January 15, 2024",
                    0.8)));
  }

  private EvidenceConstrainedGenerator generator(
      List<ClauseTool<?>> tools, ExternalCallGuard guard) {
    return new EvidenceConstrainedGenerator(
        answerAgent, tools, guard, config, objectMapper, meterRegistry);
  }

  @Nested
  @DisplayName("Prompt Construction Tests")
  class PromptConstructionTests {

    @Test
    @DisplayName("Should pass evidence in ranked order with bracketed ids")
    void shouldPassEvidenceWithIds() {
      when(answerAgent.answer(anyString(), anyString(), anyString(), anyString()))
          .thenReturn(VALID_JSON);

      generator(List.of(), PipelineFixtures.guard())
          .generate(query, evidence, List.of(), List.of(), new CancellationToken());

      verify(answerAgent)
          .answer(
              PipelineFixtures.LATE_PAYMENT_QUESTION,
              "[contract-1/clause_2] 1.5% monthly penalty after due date\n\n"
                  + "[contract-1/clause_1] Payment due within 30 days of January 15, 2024",
              EvidenceConstrainedGenerator.NONE,
              EvidenceConstrainedGenerator.NONE);
    }

    @Test
    @DisplayName("Should pass every violation of the previous attempt as feedback")
    void shouldPassFeedback() {
      when(answerAgent.answer(anyString(), anyString(), anyString(), anyString()))
          .thenReturn(VALID_JSON);

      generator(List.of(), PipelineFixtures.guard())
          .generate(
              query,
              evidence,
              List.of(),
              List.of(
                  "Cited clause 'contract-1/clause_3' is not in the evidence set",
                  "Missing required field 'risks'"),
              new CancellationToken());

      verify(answerAgent)
          .answer(
              anyString(),
              anyString(),
              eq(EvidenceConstrainedGenerator.NONE),
              eq(
                  "Your previous answer was rejected:\n"
                      + "- Cited clause 'contract-1/clause_3' is not in the evidence set\n"
                      + "- Missing required field 'risks'"));
    }

    @Test
    @DisplayName("Should not run tools when they are disabled")
    void shouldSkipToolsWhenDisabled() {
      ClauseTool<String> tool = failingTool("never_called");

      List<ToolFinding> findings =
          generator(List.of(tool), PipelineFixtures.guard())
              .collectFindings(evidence, new CancellationToken());

      assertThat(findings).isEmpty();
      assertThat(meterRegistry.find("tools.failure").counter()).isNull();
    }
  }

  @Nested
  @DisplayName("Tool Tests")
  class ToolTests {

    @BeforeEach
    void enableTools() {
      config.getTools().setEnabled(true);
    }

    @Test
    @DisplayName("Should include tool findings and drop failed or slow tools")
    void shouldIncludeFindingsAndDropFailures() {
      when(answerAgent.answer(anyString(), anyString(), anyString(), anyString()))
          .thenReturn(VALID_JSON);
      List<ClauseTool<?>> tools =
          List.of(
              new DeadlineCalculationTool(new DateNormalizationTool()),
              failingTool("broken"),
              slowTool("slow"));
      ExternalCallGuard guard =
          PipelineFixtures.guard(
              Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofMillis(100));

      EvidenceConstrainedGenerator generator = generator(tools, guard);
      CancellationToken token = new CancellationToken();

      List<ToolFinding> findings = generator.collectFindings(evidence, token);
      CandidateAnswer candidate = generator.generate(query, evidence, findings, List.of(), token);

      ArgumentCaptor<String> findingsBlock = ArgumentCaptor.forClass(String.class);
      verify(answerAgent).answer(anyString(), anyString(), findingsBlock.capture(), anyString());
      assertThat(findingsBlock.getValue())
          .isEqualTo(
              "- [contract-1/clause_1] calculate_deadline: "
                  + "{\"start\":\"2024-01-15\",\"days\":30,\"due\":\"2024-02-14\"}");
      assertThat(candidate.payload()).isNotNull();
      assertThat(meterRegistry.get("tools.failure").tag("tool", "broken").counter().count())
          .isEqualTo(2.0);
      assertThat(meterRegistry.get("tools.failure").tag("tool", "slow").counter().count())
          .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should skip tool calls the executor rejects")
    void shouldSkipRejectedToolCalls() {
      ThreadPoolTaskExecutor saturated = new ThreadPoolTaskExecutor();
      saturated.setCorePoolSize(1);
      saturated.setMaxPoolSize(1);
      saturated.setQueueCapacity(0);
      saturated.setDaemon(true);
      saturated.initialize();
      try {
        ExternalCallGuard guard = PipelineFixtures.guard(Duration.ofMillis(100), saturated);
        List<ClauseTool<?>> tools =
            List.of(slowTool("slow"), new DeadlineCalculationTool(new DateNormalizationTool()));

        List<ToolFinding> findings =
            generator(tools, guard).collectFindings(evidence, new CancellationToken());

        // the first slow call holds the only thread, every later submission is rejected
        assertThat(findings).isEmpty();
        assertThat(meterRegistry.get("tools.failure").tag("tool", "slow").counter().count())
            .isEqualTo(2.0);
        assertThat(
                meterRegistry
                    .get("tools.failure")
                    .tag("tool", "calculate_deadline")
                    .counter()
                    .count())
            .isEqualTo(2.0);
      } finally {
        saturated.shutdown();
      }
    }
  }

  @Nested
  @DisplayName("Failure Tests")
  class FailureTests {

    @Test
    @DisplayName("Should wrap agent errors as retryable generation failures")
    void shouldWrapAgentErrors() {
      when(answerAgent.answer(anyString(), anyString(), anyString(), anyString()))
          .thenThrow(new RuntimeException("503 Service Unavailable"));

      assertThatThrownBy(
              () ->
                  generator(List.of(), PipelineFixtures.guard())
                      .generate(query, evidence, List.of(), List.of(), new CancellationToken()))
          .isInstanceOf(GenerationServiceException.class)
          .hasMessageContaining("503 Service Unavailable")
          .satisfies(e -> assertThat(((PipelineException) e).isRetryable()).isTrue());
    }

    @Test
    @DisplayName("Should reject blank model output")
    void shouldRejectBlankOutput() {
      when(answerAgent.answer(anyString(), anyString(), anyString(), anyString()))
          .thenReturn("  \n ");

      assertThatThrownBy(
              () ->
                  generator(List.of(), PipelineFixtures.guard())
                      .generate(query, evidence, List.of(), List.of(), new CancellationToken()))
          .isInstanceOf(GenerationServiceException.class)
          .hasMessageContaining("no output");
    }

    @Test
    @DisplayName("Should report a slow model call as a timeout")
    void shouldReportSlowModelAsTimeout() {
      when(answerAgent.answer(anyString(), anyString(), anyString(), anyString()))
          .thenAnswer(
              invocation -> {
                Thread.sleep(5_000);
                return VALID_JSON;
              });
      ExternalCallGuard guard =
          PipelineFixtures.guard(
              Duration.ofSeconds(5), Duration.ofMillis(100), Duration.ofSeconds(5));

      assertThatThrownBy(
              () ->
                  generator(List.of(), guard)
                      .generate(query, evidence, List.of(), List.of(), new CancellationToken()))
          .isInstanceOf(StageTimeoutException.class);
    }

    @Test
    @DisplayName("Should hand non-JSON output to the validator unparsed")
    void shouldKeepNonJsonOutput() {
      when(answerAgent.answer(anyString(), anyString(), anyString(), anyString()))
          .thenReturn("  Late payment incurs a 1.5% monthly penalty.  ");

      CandidateAnswer candidate =
          generator(List.of(), PipelineFixtures.guard())
              .generate(query, evidence, List.of(), List.of(), new CancellationToken());

      assertThat(candidate.payload()).isNull();
      assertThat(candidate.rawOutput()).isEqualTo("Late payment incurs a 1.5% monthly penalty.");
    }
  }

  private static ClauseTool<String> failingTool(String name) {
    return new ClauseTool<>() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public String apply(String clauseText) {
        throw new IllegalStateException("tool backend unavailable");
      }
    };
  }

  private static ClauseTool<String> slowTool(String name) {
    return new ClauseTool<>() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public String apply(String clauseText) {
        try {
          Thread.sleep(5_000);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return "late";
      }
    };
  }
}
