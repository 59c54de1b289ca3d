package com.flamingo.ai.contractqa.service.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.contractqa.domain.model.CandidateAnswer;
import com.flamingo.ai.contractqa.domain.model.ClauseReference;
import com.flamingo.ai.contractqa.domain.model.EvidenceItem;
import com.flamingo.ai.contractqa.domain.model.EvidenceSet;
import com.flamingo.ai.contractqa.domain.model.ValidationResult;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AnswerSchemaValidator Tests")
class AnswerSchemaValidatorTest {

  private static final String PAYMENT = "contract-1/clause_1";
  private static final String PENALTY = "contract-1/clause_2";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final AnswerSchemaValidator validator = new AnswerSchemaValidator();

  private final EvidenceSet evidence =
      EvidenceSet.of(
          List.of(
              new EvidenceItem(PENALTY, 2, "1.5% monthly penalty after due date", 0.9),
              new EvidenceItem(PAYMENT, 1, "Payment due within 30 days", 0.8)));

  private ValidationResult validate(String json) {
    return validator.validate(CandidateAnswer.fromRawOutput(json, objectMapper), evidence);
  }

  // Single quotes keep the fixtures readable
  private static String json(String singleQuoted) {
    return singleQuoted.replace('\'', '"');
  }

  @Nested
  @DisplayName("Accepted Answer Tests")
  class AcceptedAnswerTests {

    @Test
    @DisplayName("Should accept a well-formed grounded answer")
    void shouldAcceptGroundedAnswer() {
      ValidationResult result =
          validate(
              json(
                  "{'summary':'Late payment incurs a penalty.',"
                      + "'obligations':['Pay within 30 days'],"
                      + "'penalties':['1.5% monthly penalty'],"
                      + "'risks':['Interest accrues monthly'],"
                      + "'supporting_clauses':[{'id':'contract-1/clause_1','text':'Payment'},"
                      + "{'id':'contract-1/clause_2','text':'penalty'}]}"));

      assertThat(result.valid()).isTrue();
      assertThat(result.violations()).isEmpty();
      assertThat(result.answer().summary()).isEqualTo("Late payment incurs a penalty.");
      assertThat(result.answer().penalties()).containsExactly("1.5% monthly penalty");
      assertThat(result.answer().supportingClauses())
          .containsExactly(
              new ClauseReference(PAYMENT, "Payment due within 30 days"),
              new ClauseReference(PENALTY, "1.5% monthly penalty after due date"));
    }

    @Test
    @DisplayName("Should accept an answer without obligations and citations")
    void shouldAcceptAnswerWithoutObligations() {
      ValidationResult result =
          validate(
              json(
                  "{'summary':'The clauses do not say.','obligations':[],'penalties':[],"
                      + "'risks':['Unclear terms'],'supporting_clauses':[]}"));

      assertThat(result.valid()).isTrue();
      assertThat(result.answer().supportingClauses()).isEmpty();
    }
  }

  @Nested
  @DisplayName("Rejected Answer Tests")
  class RejectedAnswerTests {

    @Test
    @DisplayName("Should reject output that is not JSON")
    void shouldRejectNonJson() {
      ValidationResult result = validate("Late payment incurs a penalty.");

      assertThat(result.valid()).isFalse();
      assertThat(result.answer()).isNull();
      assertThat(result.violations()).containsExactly("Answer is not valid JSON");
    }

    @Test
    @DisplayName("Should reject JSON that is not an object")
    void shouldRejectNonObject() {
      assertThat(validate("[1, 2]").violations())
          .containsExactly("Answer must be a JSON object but was ARRAY");
    }

    @Test
    @DisplayName("Should report missing and unexpected fields together")
    void shouldReportMissingAndUnexpectedFields() {
      ValidationResult result =
          validate(
              json(
                  "{'summary':'x','obligations':[],'penalties':[],"
                      + "'supporting_clauses':[],'confidence':0.9}"));

      assertThat(result.violations())
          .containsExactlyInAnyOrder(
              "Missing required field 'risks'", "Unexpected field 'confidence'");
    }

    @Test
    @DisplayName("Should reject wrongly typed fields")
    void shouldRejectWrongTypes() {
      ValidationResult result =
          validate(
              json(
                  "{'summary':42,'obligations':'pay','penalties':[1],'risks':[],"
                      + "'supporting_clauses':{}}"));

      assertThat(result.violations())
          .containsExactlyInAnyOrder(
              "Field 'summary' must be a string",
              "Field 'obligations' must be an array of strings",
              "Field 'penalties[0]' must be a string",
              "Field 'supporting_clauses' must be an array of {id, text} objects");
    }

    @Test
    @DisplayName("Should reject citations of clauses outside the evidence")
    void shouldRejectCitationOutsideEvidence() {
      ValidationResult result =
          validate(
              json(
                  "{'summary':'x','obligations':[],'penalties':['1.5% monthly'],'risks':[],"
                      + "'supporting_clauses':[{'id':'contract-1/clause_3','text':'t'}]}"));

      assertThat(result.valid()).isFalse();
      assertThat(result.violations())
          .containsExactly("Cited clause 'contract-1/clause_3' is not in the evidence set");
    }

    @Test
    @DisplayName("Should require citations when penalties are given")
    void shouldRequireCitationsForPenalties() {
      ValidationResult result =
          validate(
              json(
                  "{'summary':'x','obligations':[],'penalties':['1.5% monthly'],'risks':[],"
                      + "'supporting_clauses':[]}"));

      assertThat(result.violations())
          .containsExactly(
              "Field 'supporting_clauses' must not be empty when obligations or penalties"
                  + " are given");
    }

    @Test
    @DisplayName("Should reject duplicate citations")
    void shouldRejectDuplicateCitations() {
      ValidationResult result =
          validate(
              json(
                  "{'summary':'x','obligations':[],'penalties':[],'risks':[],"
                      + "'supporting_clauses':[{'id':'contract-1/clause_1','text':'a'},"
                      + "{'id':'contract-1/clause_1','text':'a'}]}"));

      assertThat(result.violations())
          .containsExactly("Clause 'contract-1/clause_1' is cited more than once");
    }

    @Test
    @DisplayName("Should reject malformed citation entries")
    void shouldRejectMalformedCitations() {
      ValidationResult result =
          validate(
              json(
                  "{'summary':'x','obligations':[],'penalties':[],'risks':[],"
                      + "'supporting_clauses':['contract-1/clause_1',"
                      + "{'id':'contract-1/clause_2'}]}"));

      assertThat(result.violations())
          .containsExactlyInAnyOrder(
              "Entry 'supporting_clauses[0]' must be an object",
              "Entry 'supporting_clauses[1]' needs a string 'text'");
    }
  }
}
