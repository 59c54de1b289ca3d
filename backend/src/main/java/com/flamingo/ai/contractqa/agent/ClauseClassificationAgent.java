package com.flamingo.ai.contractqa.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent labelling a single contract clause with a coarse category. */
public interface ClauseClassificationAgent {

  @SystemMessage(
      """
        You classify contract clauses. Reply with exactly one of these labels:
        PAYMENT, PENALTY, OBLIGATION, CONFIDENTIALITY, TERMINATION, LIABILITY, DEFINITION, OTHER

        Return ONLY the label. Do not include explanations.
        """)
  @UserMessage(
      """
        Clause: {{clause}}

        Label:
        """)
  String classify(@V("clause") String clause);
}
