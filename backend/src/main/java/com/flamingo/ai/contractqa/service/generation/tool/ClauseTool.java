package com.flamingo.ai.contractqa.service.generation.tool;

/**
 * Auxiliary extraction run on a single evidence clause before generation.
 *
 * @param <T> type of the finding
 */
public interface ClauseTool<T> {

  /** Tool name as shown to the generation model. */
  String name();

  /**
   * Extracts a finding from clause text.
   *
   * @param clauseText trimmed clause text
   * @return the finding, or null when the clause has nothing for this tool
   */
  T apply(String clauseText);
}
