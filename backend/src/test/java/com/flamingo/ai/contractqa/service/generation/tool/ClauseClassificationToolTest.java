package com.flamingo.ai.contractqa.service.generation.tool;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

import com.flamingo.ai.contractqa.agent.ClauseClassificationAgent;
import com.flamingo.ai.contractqa.domain.enums.ClauseCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClauseClassificationTool Tests")
class ClauseClassificationToolTest {

  @Mock private ClauseClassificationAgent agent;

  private ClauseClassificationTool tool;

  @BeforeEach
  void setUp() {
    tool = new ClauseClassificationTool(agent);
  }

  @Test
  @DisplayName("Should map the agent label to a category")
  void shouldMapLabel() {
    when(agent.classify("1.5% monthly penalty after due date")).thenReturn(" penalty.\n");

    assertThat(tool.apply("1.5% monthly penalty after due date")).isEqualTo(ClauseCategory.PENALTY);
  }

  @Test
  @DisplayName("Should fall back to UNKNOWN for unrecognised labels")
  void shouldFallBackForUnknownLabel() {
    when(agent.classify(anyString())).thenReturn("I think this is about money");

    assertThat(tool.apply("Payment due within 30 days")).isEqualTo(ClauseCategory.UNKNOWN);
  }

  @Test
  @DisplayName("Should fall back to UNKNOWN when the agent fails")
  void shouldFallBackWhenAgentFails() {
    when(agent.classify(anyString())).thenThrow(new RuntimeException("rate limited"));

    assertThat(tool.apply("Payment due within 30 days")).isEqualTo(ClauseCategory.UNKNOWN);
  }
}
