package com.flamingo.ai.contractqa.service.generation.tool;

import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Extracts the first monetary amount of a clause, e.g. {@code $1,250.00} or {@code 300 EUR}. */
@Component
public class AmountExtractionTool implements ClauseTool<AmountExtractionTool.MonetaryAmount> {

  private static final Map<String, String> CURRENCY_CODES =
      Map.of("$", "USD", "USD", "USD", "€", "EUR", "EUR", "EUR", "£", "GBP", "GBP", "GBP");

  private static final String NUMBER = "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)";

  private static final Pattern PREFIXED =
      Pattern.compile("(\\$|€|£|\\bUSD|\\bEUR|\\bGBP)\\s?" + NUMBER);

  private static final Pattern SUFFIXED = Pattern.compile(NUMBER + "\\s?(USD|EUR|GBP)\\b");

  /** An amount with its ISO currency code. */
  public record MonetaryAmount(BigDecimal value, String currency) {}

  @Override
  public String name() {
    return "extract_amount";
  }

  @Override
  public MonetaryAmount apply(String clauseText) {
    Matcher prefixed = PREFIXED.matcher(clauseText);
    Matcher suffixed = SUFFIXED.matcher(clauseText);
    boolean hasPrefixed = prefixed.find();
    boolean hasSuffixed = suffixed.find();

    if (hasPrefixed && (!hasSuffixed || prefixed.start() <= suffixed.start())) {
      return amount(prefixed.group(2), prefixed.group(1));
    }
    if (hasSuffixed) {
      return amount(suffixed.group(1), suffixed.group(2));
    }
    return null;
  }

  private MonetaryAmount amount(String number, String currency) {
    return new MonetaryAmount(
        new BigDecimal(number.replace(",", "")), CURRENCY_CODES.get(currency));
  }
}
