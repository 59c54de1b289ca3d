package com.flamingo.ai.contractqa.domain.model;

/**
 * An addressable, independently retrievable clause of a document.
 *
 * @param id stable citation id, derived from the document id and ordinal
 * @param ordinal 1-based position in document order
 * @param text trimmed clause text, never empty
 * @param span region of the original text covered by this clause
 */
public record ClauseUnit(String id, int ordinal, String text, SourceSpan span) {

  public static String idFor(String documentId, int ordinal) {
    return documentId + "/clause_" + ordinal;
  }
}
