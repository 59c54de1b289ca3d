package com.flamingo.ai.contractqa.exception;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;
import java.util.List;

/**
 * Exception thrown when every repair attempt produced an invalid answer. Carries the violations of
 * the last candidate for diagnosis.
 */
public class SchemaValidationExhaustedException extends PipelineException {

  private final int attempts;
  private final List<String> violations;

  public SchemaValidationExhaustedException(int attempts, List<String> violations) {
    super(
        ErrorKind.SCHEMA_VALIDATION_EXHAUSTED,
        String.format(
            "Answer failed schema validation after %d attempts: %s", attempts, violations),
        "Could not produce a well-formed answer grounded in the retrieved clauses");
    this.attempts = attempts;
    this.violations = List.copyOf(violations);
  }

  public int getAttempts() {
    return attempts;
  }

  public List<String> getViolations() {
    return violations;
  }
}
