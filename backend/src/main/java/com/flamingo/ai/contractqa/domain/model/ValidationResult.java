package com.flamingo.ai.contractqa.domain.model;

import java.util.List;

/**
 * Outcome of validating a candidate answer. {@code answer} is present exactly when {@code valid}
 * is true.
 */
public record ValidationResult(boolean valid, List<String> violations, ContractAnswer answer) {

  public static ValidationResult accepted(ContractAnswer answer) {
    return new ValidationResult(true, List.of(), answer);
  }

  public static ValidationResult rejected(List<String> violations) {
    if (violations.isEmpty()) {
      throw new IllegalArgumentException("A rejected result needs at least one violation");
    }
    return new ValidationResult(false, List.copyOf(violations), null);
  }
}
