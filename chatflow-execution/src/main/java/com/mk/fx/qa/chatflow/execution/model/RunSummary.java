package com.mk.fx.qa.chatflow.execution.model;

import java.time.Instant;

/** History entry for a finished run. */
public record RunSummary(
    String runId,
    ExecutionPhase finalPhase,
    Instant startTime,
    Instant endTime,
    int totalTurns,
    int succeeded,
    int failed,
    int skipped,
    int cancelled,
    double successRate,
    Double avgLatencySeconds,
    String errorMessage) {}
