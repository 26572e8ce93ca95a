package com.mk.fx.qa.chatflow.execution.service;

import com.mk.fx.qa.chatflow.execution.cfg.ExecutionCfg;
import com.mk.fx.qa.chatflow.execution.model.ExecutionStatus;
import com.mk.fx.qa.chatflow.execution.model.LogEntry;
import com.mk.fx.qa.chatflow.execution.model.LogLevel;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Holds the published execution status and the run log.
 *
 * <p>Status readers get the last published immutable snapshot and never wait for the worker. The
 * run log keeps every entry of the current run; the most recent {@code log-buffer-size} entries are
 * embedded in each snapshot.
 */
@Slf4j
@Component
public class ExecutionStatusReporter {

  private final int bufferSize;
  private final Clock clock;
  private final AtomicReference<ExecutionStatus> current =
      new AtomicReference<>(ExecutionStatus.idle());
  private final Deque<LogEntry> recent = new ArrayDeque<>();
  private final List<LogEntry> full = new ArrayList<>();

  @Autowired
  public ExecutionStatusReporter(ExecutionCfg cfg) {
    this(cfg.getLogBufferSize(), Clock.systemUTC());
  }

  public ExecutionStatusReporter(int bufferSize, Clock clock) {
    if (bufferSize < 1) {
      throw new IllegalArgumentException("bufferSize must be positive");
    }
    this.bufferSize = bufferSize;
    this.clock = clock;
  }

  public ExecutionStatus snapshot() {
    return current.get();
  }

  public void publish(ExecutionStatus status) {
    current.set(status);
  }

  /** Appends a run log entry and mirrors it to the application log. */
  public LogEntry log(LogLevel level, String message) {
    var entry = new LogEntry(clock.instant(), level, message);
    synchronized (this) {
      recent.addLast(entry);
      while (recent.size() > bufferSize) {
        recent.pollFirst();
      }
      full.add(entry);
    }
    switch (level) {
      case ERROR -> log.error("[run] {}", message);
      case WARNING -> log.warn("[run] {}", message);
      default -> log.info("[run] {}", message);
    }
    return entry;
  }

  /** The most recent entries, oldest first, at most the buffer size. */
  public synchronized List<LogEntry> recentLogs() {
    return List.copyOf(recent);
  }

  /** The last {@code limit} entries of the buffer, oldest first. */
  public synchronized List<LogEntry> recentLogs(int limit) {
    var logs = List.copyOf(recent);
    if (limit <= 0 || limit >= logs.size()) {
      return logs;
    }
    return logs.subList(logs.size() - limit, logs.size());
  }

  /** Every entry logged since the last {@link #clear()}. */
  public synchronized List<LogEntry> fullLog() {
    return List.copyOf(full);
  }

  public synchronized void clear() {
    recent.clear();
    full.clear();
  }

  public int bufferSize() {
    return bufferSize;
  }
}
