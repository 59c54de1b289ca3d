package com.flamingo.ai.contractqa.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * A validated answer. Instances are only created by the schema validator (or for the zero-evidence
 * case) so every cited clause is known to have been retrieved for the query.
 */
@JsonPropertyOrder({"summary", "obligations", "penalties", "risks", "supporting_clauses"})
public record ContractAnswer(
    String summary,
    List<String> obligations,
    List<String> penalties,
    List<String> risks,
    @JsonProperty("supporting_clauses") List<ClauseReference> supportingClauses) {

  public ContractAnswer {
    obligations = List.copyOf(obligations);
    penalties = List.copyOf(penalties);
    risks = List.copyOf(risks);
    supportingClauses = List.copyOf(supportingClauses);
  }

  /** Answer returned when retrieval found no clauses at all. */
  public static ContractAnswer noEvidence() {
    return new ContractAnswer(
        "No clauses relevant to this question were found in the document.",
        List.of(),
        List.of(),
        List.of(),
        List.of());
  }
}
