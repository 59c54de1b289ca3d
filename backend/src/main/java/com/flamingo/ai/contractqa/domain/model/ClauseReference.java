package com.flamingo.ai.contractqa.domain.model;

/** A clause cited as evidence for an answer. */
public record ClauseReference(String id, String text) {}
