package com.flamingo.ai.contractqa.service.generation.tool;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Finds the first date written in a clause and normalizes it to ISO-8601. */
@Component
public class DateNormalizationTool implements ClauseTool<LocalDate> {

  private static final String MONTHS =
      "(?:January|February|March|April|May|June|July|August|September|October|November|December)";

  private static final List<DatePattern> PATTERNS =
      List.of(
          new DatePattern(Pattern.compile("\\b(\\d{4}-\\d{2}-\\d{2})\\b"), "uuuu-MM-dd"),
          new DatePattern(
              Pattern.compile("\\b(" + MONTHS + "\\s+\\d{1,2},\\s*\\d{4})\\b"), "MMMM d, uuuu"),
          new DatePattern(
              Pattern.compile("\\b(\\d{1,2}\\s+" + MONTHS + ",?\\s+\\d{4})\\b"), "d MMMM uuuu"),
          new DatePattern(Pattern.compile("\\b(\\d{1,2}/\\d{1,2}/\\d{4})\\b"), "M/d/uuuu"));

  @Override
  public String name() {
    return "normalize_date";
  }

  @Override
  public LocalDate apply(String clauseText) {
    LocalDate earliest = null;
    int earliestPosition = Integer.MAX_VALUE;
    for (DatePattern pattern : PATTERNS) {
      Matcher matcher = pattern.regex().matcher(clauseText);
      while (matcher.find() && matcher.start() < earliestPosition) {
        LocalDate parsed = pattern.parse(matcher.group(1));
        if (parsed != null) {
          earliest = parsed;
          earliestPosition = matcher.start();
        }
      }
    }
    return earliest;
  }

  private record DatePattern(Pattern regex, String format) {

    LocalDate parse(String text) {
      String normalized = text.replaceAll("\\s+", " ").replace(" ,", ",");
      if (format.equals("d MMMM uuuu")) {
        normalized = normalized.replace(",", "");
      } else if (format.equals("MMMM d, uuuu")) {
        normalized = normalized.replaceAll(",\\s*", ", ");
      }
      try {
        return LocalDate.parse(
            normalized,
            DateTimeFormatter.ofPattern(format, Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT));
      } catch (DateTimeParseException e) {
        return null;
      }
    }
  }
}
