package com.mk.fx.qa.chatflow.execution.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of the current run, as exposed to status readers.
 *
 * @param logs the most recent run log entries, oldest first
 * @param lastReply preview of the latest reply received
 * @param errorMessage cause of an {@link ExecutionPhase#ERROR} phase
 */
public record ExecutionStatus(
    String runId,
    ExecutionPhase phase,
    Progress progress,
    Statistics statistics,
    Instant startTime,
    Instant endTime,
    List<LogEntry> logs,
    List<ValidationError> validationErrors,
    String lastReply,
    String errorMessage) {

  public ExecutionStatus {
    logs = logs != null ? List.copyOf(logs) : List.of();
    validationErrors = validationErrors != null ? List.copyOf(validationErrors) : List.of();
  }

  public static ExecutionStatus idle() {
    return new ExecutionStatus(
        null,
        ExecutionPhase.IDLE,
        Progress.empty(),
        Statistics.empty(),
        null,
        null,
        List.of(),
        List.of(),
        null,
        null);
  }
}
