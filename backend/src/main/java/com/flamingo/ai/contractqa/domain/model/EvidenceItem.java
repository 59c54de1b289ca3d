package com.flamingo.ai.contractqa.domain.model;

/** A retrieved clause with its similarity score. */
public record EvidenceItem(String unitId, int ordinal, String text, double score) {}
