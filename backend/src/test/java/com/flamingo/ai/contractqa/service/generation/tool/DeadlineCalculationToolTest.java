package com.flamingo.ai.contractqa.service.generation.tool;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.contractqa.service.generation.tool.DeadlineCalculationTool.Deadline;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DeadlineCalculationTool Tests")
class DeadlineCalculationToolTest {

  private final DeadlineCalculationTool tool =
      new DeadlineCalculationTool(new DateNormalizationTool());

  @Test
  @DisplayName("Should add the period to the start date")
  void shouldAddPeriodToStartDate() {
    assertThat(tool.apply("Payment is due within 30 days of January 15, 2024."))
        .isEqualTo(new Deadline(LocalDate.of(2024, 1, 15), 30, LocalDate.of(2024, 2, 14)));
  }

  @Test
  @DisplayName("Should read periods written in words and digits")
  void shouldReadWordsAndDigits() {
    assertThat(tool.apply("Notice of thirty (30) calendar days after 2024-06-01 is required."))
        .isEqualTo(new Deadline(LocalDate.of(2024, 6, 1), 30, LocalDate.of(2024, 7, 1)));
  }

  @Test
  @DisplayName("Should return null without a start date")
  void shouldReturnNullWithoutStartDate() {
    assertThat(tool.apply("Payment due within 30 days")).isNull();
  }

  @Test
  @DisplayName("Should return null without a period")
  void shouldReturnNullWithoutPeriod() {
    assertThat(tool.apply("This agreement starts on 2024-06-01.")).isNull();
  }
}
