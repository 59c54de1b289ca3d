package com.flamingo.ai.contractqa.service.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.contractqa.domain.model.CandidateAnswer;
import com.flamingo.ai.contractqa.domain.model.ClauseReference;
import com.flamingo.ai.contractqa.domain.model.ContractAnswer;
import com.flamingo.ai.contractqa.domain.model.EvidenceItem;
import com.flamingo.ai.contractqa.domain.model.EvidenceSet;
import com.flamingo.ai.contractqa.domain.model.ValidationResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Checks a candidate answer against the answer schema and the evidence retrieved for its query.
 *
 * <p>Every problem found is reported, not only the first, so a repair attempt can fix them all.
 * Validation has no side effects. An accepted answer carries the evidence set's clause text, not
 * the text the model copied.
 */
@Component
public class AnswerSchemaValidator {

  static final String SUMMARY = "summary";
  static final String OBLIGATIONS = "obligations";
  static final String PENALTIES = "penalties";
  static final String RISKS = "risks";
  static final String SUPPORTING_CLAUSES = "supporting_clauses";

  private static final Set<String> REQUIRED_FIELDS =
      new LinkedHashSet<>(List.of(SUMMARY, OBLIGATIONS, PENALTIES, RISKS, SUPPORTING_CLAUSES));

  public ValidationResult validate(CandidateAnswer candidate, EvidenceSet evidence) {
    JsonNode payload = candidate.payload();
    if (payload == null) {
      return ValidationResult.rejected(List.of("Answer is not valid JSON"));
    }
    if (!payload.isObject()) {
      return ValidationResult.rejected(
          List.of("Answer must be a JSON object but was " + payload.getNodeType()));
    }

    List<String> violations = new ArrayList<>();
    checkFieldNames(payload, violations);

    JsonNode summary = payload.get(SUMMARY);
    if (summary != null && !summary.isTextual()) {
      violations.add("Field 'summary' must be a string");
    }
    List<String> obligations = stringArray(payload, OBLIGATIONS, violations);
    List<String> penalties = stringArray(payload, PENALTIES, violations);
    List<String> risks = stringArray(payload, RISKS, violations);
    List<String> citedIds = citedIds(payload, violations);

    if (citedIds != null) {
      boolean needsSupport =
          obligations != null && !obligations.isEmpty()
              || penalties != null && !penalties.isEmpty();
      if (needsSupport && citedIds.isEmpty()) {
        violations.add(
            "Field 'supporting_clauses' must not be empty when obligations or penalties are given");
      }
      Set<String> seen = new HashSet<>();
      for (String id : citedIds) {
        if (!evidence.contains(id)) {
          violations.add("Cited clause '" + id + "' is not in the evidence set");
        }
        if (!seen.add(id)) {
          violations.add("Clause '" + id + "' is cited more than once");
        }
      }
    }

    if (!violations.isEmpty()) {
      return ValidationResult.rejected(violations);
    }

    List<ClauseReference> references = new ArrayList<>(citedIds.size());
    for (String id : citedIds) {
      EvidenceItem item = evidence.find(id).orElseThrow();
      references.add(new ClauseReference(id, item.text()));
    }
    return ValidationResult.accepted(
        new ContractAnswer(summary.asText(), obligations, penalties, risks, references));
  }

  private void checkFieldNames(JsonNode payload, List<String> violations) {
    for (String field : REQUIRED_FIELDS) {
      if (!payload.has(field)) {
        violations.add("Missing required field '" + field + "'");
      }
    }
    Iterator<String> names = payload.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (!REQUIRED_FIELDS.contains(name)) {
        violations.add("Unexpected field '" + name + "'");
      }
    }
  }

  /** Returns the array's strings, or null when the field is missing or malformed. */
  private List<String> stringArray(JsonNode payload, String field, List<String> violations) {
    JsonNode node = payload.get(field);
    if (node == null) {
      return null;
    }
    if (!node.isArray()) {
      violations.add("Field '" + field + "' must be an array of strings");
      return null;
    }
    List<String> values = new ArrayList<>(node.size());
    for (int i = 0; i < node.size(); i++) {
      JsonNode element = node.get(i);
      if (!element.isTextual()) {
        violations.add(String.format("Field '%s[%d]' must be a string", field, i));
        return null;
      }
      values.add(element.asText());
    }
    return values;
  }

  /** Returns cited ids in order, or null when the field is missing or malformed. */
  private List<String> citedIds(JsonNode payload, List<String> violations) {
    JsonNode node = payload.get(SUPPORTING_CLAUSES);
    if (node == null) {
      return null;
    }
    if (!node.isArray()) {
      violations.add("Field 'supporting_clauses' must be an array of {id, text} objects");
      return null;
    }
    List<String> ids = new ArrayList<>(node.size());
    boolean wellFormed = true;
    for (int i = 0; i < node.size(); i++) {
      JsonNode clause = node.get(i);
      if (!clause.isObject()) {
        violations.add(String.format("Entry 'supporting_clauses[%d]' must be an object", i));
        wellFormed = false;
        continue;
      }
      JsonNode id = clause.get("id");
      JsonNode text = clause.get("text");
      if (id == null || !id.isTextual() || id.asText().isBlank()) {
        violations.add(String.format("Entry 'supporting_clauses[%d]' needs a string 'id'", i));
        wellFormed = false;
      }
      if (text == null || !text.isTextual()) {
        violations.add(String.format("Entry 'supporting_clauses[%d]' needs a string 'text'", i));
        wellFormed = false;
      }
      if (wellFormed) {
        ids.add(id.asText());
      }
    }
    return wellFormed ? ids : null;
  }
}
