package com.flamingo.ai.contractqa.domain.model;

/**
 * Character range of a clause in the document text.
 *
 * @param start inclusive start offset
 * @param end exclusive end offset
 */
public record SourceSpan(int start, int end) {

  public SourceSpan {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
    }
  }

  public int length() {
    return end - start;
  }
}
