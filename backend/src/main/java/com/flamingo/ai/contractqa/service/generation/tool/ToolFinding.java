package com.flamingo.ai.contractqa.service.generation.tool;

/** A non-null result of running one tool on one evidence clause. */
public record ToolFinding(String tool, String unitId, Object value) {}
