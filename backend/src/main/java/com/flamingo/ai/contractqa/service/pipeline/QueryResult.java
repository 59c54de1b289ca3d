package com.flamingo.ai.contractqa.service.pipeline;

import com.flamingo.ai.contractqa.domain.model.ContractAnswer;
import com.flamingo.ai.contractqa.domain.model.EvidenceSet;

/** A finished query: the validated answer, the evidence it was checked against and the run. */
public record QueryResult(ContractAnswer answer, EvidenceSet evidence, RunStateView run) {}
