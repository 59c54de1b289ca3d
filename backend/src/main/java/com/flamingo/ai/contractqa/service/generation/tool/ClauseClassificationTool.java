package com.flamingo.ai.contractqa.service.generation.tool;

import com.flamingo.ai.contractqa.agent.ClauseClassificationAgent;
import com.flamingo.ai.contractqa.domain.enums.ClauseCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Labels a clause with a {@link ClauseCategory} using the classification agent. */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClauseClassificationTool implements ClauseTool<ClauseCategory> {

  private final ClauseClassificationAgent classificationAgent;

  @Override
  public String name() {
    return "classify_clause";
  }

  @Override
  public ClauseCategory apply(String clauseText) {
    try {
      return ClauseCategory.fromLabel(classificationAgent.classify(clauseText));
    } catch (RuntimeException e) {
      log.warn("Clause classification failed, using UNKNOWN: {}", e.getMessage());
      return ClauseCategory.UNKNOWN;
    }
  }
}
