package com.flamingo.ai.contractqa.service.generation.tool;

import java.time.LocalDate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Computes a due date for clauses that state both a start date and a period in days, such as
 * "within 30 days of March 1, 2024".
 */
@Component
@RequiredArgsConstructor
public class DeadlineCalculationTool implements ClauseTool<DeadlineCalculationTool.Deadline> {

  private static final Pattern PERIOD =
      Pattern.compile(
          "(\\d{1,4})\\)?\\s+(?:calendar\\s+)?days?\\b", Pattern.CASE_INSENSITIVE);

  private final DateNormalizationTool dateNormalizationTool;

  /** Start date, period and resulting due date. */
  public record Deadline(LocalDate start, int days, LocalDate due) {}

  @Override
  public String name() {
    return "calculate_deadline";
  }

  @Override
  public Deadline apply(String clauseText) {
    Matcher period = PERIOD.matcher(clauseText);
    if (!period.find()) {
      return null;
    }
    LocalDate start = dateNormalizationTool.apply(clauseText);
    if (start == null) {
      return null;
    }
    int days = Integer.parseInt(period.group(1));
    return new Deadline(start, days, start.plusDays(days));
  }
}
