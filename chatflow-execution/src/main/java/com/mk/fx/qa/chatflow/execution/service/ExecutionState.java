package com.mk.fx.qa.chatflow.execution.service;

import com.mk.fx.qa.chatflow.execution.metrics.LatencyTracker;
import com.mk.fx.qa.chatflow.execution.model.ExecutionPhase;
import com.mk.fx.qa.chatflow.execution.model.ExecutionStatus;
import com.mk.fx.qa.chatflow.execution.model.LogEntry;
import com.mk.fx.qa.chatflow.execution.model.Progress;
import com.mk.fx.qa.chatflow.execution.model.ResultRecord;
import com.mk.fx.qa.chatflow.execution.model.RunSummary;
import com.mk.fx.qa.chatflow.execution.model.Statistics;
import com.mk.fx.qa.chatflow.execution.model.ValidationError;
import java.time.Instant;
import java.util.List;

/**
 * Mutable state of the current run. Owned by {@link ChatflowExecutionService} and only touched
 * while holding its lock; readers see it through {@link ExecutionStatus} snapshots.
 */
final class ExecutionState {

  private static final int REPLY_PREVIEW_LENGTH = 200;

  String runId;
  ExecutionPhase phase = ExecutionPhase.IDLE;
  int total;
  int completed;
  int succeeded;
  int failed;
  int skipped;
  int cancelled;
  String currentItem;
  Instant startTime;
  Instant endTime;
  List<ValidationError> validationErrors = List.of();
  String lastReply;
  String errorMessage;
  final LatencyTracker latencies = new LatencyTracker();

  static ExecutionState idle() {
    return new ExecutionState();
  }

  static ExecutionState started(
      String runId, int total, List<ValidationError> validationErrors, Instant startTime) {
    var state = new ExecutionState();
    state.runId = runId;
    state.phase = ExecutionPhase.RUNNING;
    state.total = total;
    state.validationErrors = List.copyOf(validationErrors);
    state.startTime = startTime;
    return state;
  }

  void record(ResultRecord record) {
    completed++;
    switch (record.finalStatus()) {
      case SUCCESS -> {
        succeeded++;
        lastReply = preview(record.actualReply());
      }
      case FAILED -> failed++;
      case SKIPPED_DUE_TO_PRIOR_FAILURE -> skipped++;
      case CANCELLED -> cancelled++;
    }
    if (record.latencySeconds() != null) {
      latencies.record(record.latencySeconds());
    }
  }

  double successRate() {
    return completed == 0 ? 0.0 : succeeded * 100.0 / completed;
  }

  ExecutionStatus toStatus(List<LogEntry> logs) {
    return new ExecutionStatus(
        runId,
        phase,
        new Progress(total, completed, succeeded, failed, skipped, cancelled, currentItem),
        new Statistics(
            latencies.minSeconds().orElse(null),
            latencies.avgSeconds().orElse(null),
            latencies.maxSeconds().orElse(null),
            successRate()),
        startTime,
        endTime,
        logs,
        validationErrors,
        lastReply,
        errorMessage);
  }

  RunSummary toSummary() {
    return new RunSummary(
        runId,
        phase,
        startTime,
        endTime,
        total,
        succeeded,
        failed,
        skipped,
        cancelled,
        successRate(),
        latencies.avgSeconds().orElse(null),
        errorMessage);
  }

  private static String preview(String reply) {
    if (reply == null) {
      return null;
    }
    return reply.length() > REPLY_PREVIEW_LENGTH
        ? reply.substring(0, REPLY_PREVIEW_LENGTH) + "..."
        : reply;
  }
}
