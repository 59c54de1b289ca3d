package com.flamingo.ai.contractqa.domain.enums;

import java.util.Locale;

/** Coarse category labels assigned to a clause by the classification tool. */
public enum ClauseCategory {
  PAYMENT,
  PENALTY,
  OBLIGATION,
  CONFIDENTIALITY,
  TERMINATION,
  LIABILITY,
  DEFINITION,
  OTHER,
  UNKNOWN;

  /**
   * Maps a free-form label to a category. Anything unrecognised maps to {@link #UNKNOWN}.
   *
   * @param label label text, may be null
   * @return the matching category
   */
  public static ClauseCategory fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return UNKNOWN;
    }
    String normalized =
        label.trim().replaceAll("[^A-Za-z_]", "").toUpperCase(Locale.ROOT);
    for (ClauseCategory category : values()) {
      if (category.name().equals(normalized)) {
        return category;
      }
    }
    return UNKNOWN;
  }
}
