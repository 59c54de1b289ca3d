package com.flamingo.ai.contractqa.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent answering a question about a contract from retrieved clauses only.
 *
 * <p>The raw output is untrusted; it is parsed and schema-checked before anything uses it.
 */
public interface ContractAnswerAgent {

  @SystemMessage(
      """
        You are a contract analysis assistant. You answer questions about a contract using
        ONLY the clauses listed under "Evidence". Never use outside knowledge.

        Return a single JSON object with exactly these fields and nothing else:
        - summary (string): a short answer to the question
        - obligations (array of strings): obligations stated in the evidence
        - penalties (array of strings): penalties, fines or interest stated in the evidence
        - risks (array of strings): risks for the parties that follow from the evidence
        - supporting_clauses (array of objects with "id" and "text"): the clauses you relied on

        Rules:
        1. Every id in supporting_clauses MUST be one of the bracketed ids under "Evidence"
        2. If obligations or penalties are not empty, supporting_clauses must not be empty
        3. Copy clause text from the evidence; do not paraphrase it
        4. Use empty arrays when the evidence says nothing about a field
        5. Tool findings are hints extracted from the evidence; cite the clause, not the tool
        6. If "Corrections" lists problems with your previous answer, fix all of them
        """)
  @UserMessage(
      """
        Question: {{question}}

        Evidence:
        {{evidence}}

        Tool findings:
        {{toolFindings}}

        Corrections:
        {{feedback}}

        Return the JSON object.
        """)
  String answer(
      @V("question") String question,
      @V("evidence") String evidence,
      @V("toolFindings") String toolFindings,
      @V("feedback") String feedback);
}
