package com.flamingo.ai.contractqa.service.pipeline;

import com.flamingo.ai.contractqa.domain.enums.ErrorKind;
import java.time.Instant;

/** Immutable snapshot of a {@link RunState}. */
public record RunStateView(
    String runId,
    String stage,
    int attemptCount,
    int serviceRetryCount,
    ErrorKind lastError,
    Instant startedAt,
    Instant updatedAt) {}
