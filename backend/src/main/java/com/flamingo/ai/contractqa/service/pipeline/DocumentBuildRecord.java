package com.flamingo.ai.contractqa.service.pipeline;

/** Build progress of one document. */
public record DocumentBuildRecord(
    String documentId, String contentHash, int unitCount, RunStateView run) {}
