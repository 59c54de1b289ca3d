package com.flamingo.ai.contractqa.domain.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Untrusted generator output. Nothing in it is relied upon until {@link
 * com.flamingo.ai.contractqa.service.validation.AnswerSchemaValidator} has accepted it.
 *
 * @param rawOutput text exactly as returned by the generation service
 * @param payload parsed JSON tree, or null when the output is not JSON
 */
public record CandidateAnswer(String rawOutput, JsonNode payload) {

  public static CandidateAnswer fromRawOutput(String rawOutput, ObjectMapper objectMapper) {
    try {
      return new CandidateAnswer(rawOutput, objectMapper.readTree(rawOutput));
    } catch (JsonProcessingException e) {
      return new CandidateAnswer(rawOutput, null);
    }
  }
}
