package com.mk.fx.qa.chatflow.execution.service;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.chatflow.execution.cfg.ExecutionCfg;
import com.mk.fx.qa.chatflow.execution.grouping.CaseGrouper;
import com.mk.fx.qa.chatflow.execution.model.ControlError;
import com.mk.fx.qa.chatflow.execution.model.ControlResult;
import com.mk.fx.qa.chatflow.execution.model.ConversationGroup;
import com.mk.fx.qa.chatflow.execution.model.ExecutionPhase;
import com.mk.fx.qa.chatflow.execution.model.ExecutionStatus;
import com.mk.fx.qa.chatflow.execution.model.LogEntry;
import com.mk.fx.qa.chatflow.execution.model.LogLevel;
import com.mk.fx.qa.chatflow.execution.model.ResultRecord;
import com.mk.fx.qa.chatflow.execution.model.RunSummary;
import com.mk.fx.qa.chatflow.execution.model.TestCase;
import com.mk.fx.qa.chatflow.execution.runner.ConversationRunner;
import com.mk.fx.qa.chatflow.execution.runner.TurnCompletionListener;
import com.mk.fx.qa.chatflow.execution.runner.TurnPacer;
import com.mk.fx.qa.chatflow.execution.sink.ResultSink;
import com.mk.fx.qa.chatflow.execution.sink.ResultSinkException;
import com.mk.fx.qa.chatflow.rest.CallOutcome;
import com.mk.fx.qa.chatflow.rest.RetryingChatClient;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs uploaded conversations against the chat API and exposes the controllable run lifecycle.
 *
 * <p>Phases: IDLE → RUNNING ⇄ PAUSED; RUNNING/PAUSED → STOPPING → STOPPED; RUNNING → COMPLETED;
 * RUNNING → ERROR. Restart and reset are accepted from STOPPED, COMPLETED and ERROR.
 *
 * <p>Conversations run one at a time on a single dedicated worker thread. Pause and stop are
 * cooperative: a pause takes effect at the next conversation boundary, a stop at the next turn or
 * conversation boundary. Every result record is appended to the {@link ResultSink} before progress
 * is updated and before the next turn starts.
 *
 * <p>Thread-safety: the mutable {@link ExecutionState} is guarded by a single lock that is never
 * held during a chat API call. After each change an immutable {@link ExecutionStatus} is published
 * to the {@link ExecutionStatusReporter}, so status reads never block on the worker.
 */
@Slf4j
@Service
public class ChatflowExecutionService {

  private static final DateTimeFormatter RUN_ID_FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

  private final ExecutionCfg properties;
  private final CaseGrouper grouper;
  private final TestCaseStore testCaseStore;
  private final RetryingChatClient chatClient;
  private final ResultSink resultSink;
  private final ExecutionStatusReporter reporter;
  private final ConversationRunner runner;
  private final TurnPacer pacer;
  private final ThreadPoolExecutor executor;
  private final Deque<RunSummary> runHistory;
  private final AtomicBoolean acceptingRuns;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition phaseChanged = lock.newCondition();

  // guarded by lock
  private ExecutionState state = ExecutionState.idle();

  public ChatflowExecutionService(
      ExecutionCfg properties,
      CaseGrouper grouper,
      TestCaseStore testCaseStore,
      RetryingChatClient chatClient,
      ResultSink resultSink,
      ExecutionStatusReporter reporter) {
    this.properties = properties;
    this.grouper = grouper;
    this.testCaseStore = testCaseStore;
    this.chatClient = chatClient;
    this.resultSink = resultSink;
    this.reporter = reporter;
    this.clock = Clock.systemUTC();
    this.pacer = new TurnPacer(properties.getTurnInterval());
    this.runner = new ConversationRunner(pacer, clock);
    this.executor = createExecutor();
    this.runHistory = new ConcurrentLinkedDeque<>();
    this.acceptingRuns = new AtomicBoolean(true);
  }

  @PostConstruct
  void logConfiguration() {
    log.info(
        "ChatflowExecutionService initialised with mode={} turnInterval={}ms historySize={}"
            + " resultsDir={}",
        chatClient.mode(),
        properties.getTurnInterval().toMillis(),
        properties.getHistorySize(),
        properties.getResultsDir());
  }

  private ThreadPoolExecutor createExecutor() {
    ThreadFactory threadFactory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName("chatflow-run-worker-" + thread.getId());
          thread.setDaemon(true);
          return thread;
        };
    ThreadPoolExecutor pool =
        new ThreadPoolExecutor(
            1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), threadFactory);
    pool.setRejectedExecutionHandler(
        (runnable, exec) -> {
          throw new RejectedExecutionException("Run worker is shut down");
        });
    return pool;
  }

  // -----------------------------------------------------
  // Control operations
  // -----------------------------------------------------

  /** Validates the uploaded test cases and starts a new run. Accepted only while IDLE. */
  public ControlResult start() {
    lock.lock();
    try {
      if (state.phase != ExecutionPhase.IDLE) {
        return invalidState("start", "reset or restart the finished run first");
      }
      return startLocked();
    } finally {
      lock.unlock();
    }
  }

  /** Requests a pause at the next conversation boundary. Accepted only while RUNNING. */
  public ControlResult pause() {
    lock.lock();
    try {
      if (state.phase != ExecutionPhase.RUNNING) {
        return invalidState("pause", null);
      }
      state.phase = ExecutionPhase.PAUSED;
      logAndPublish(
          LogLevel.WARNING, "Pause requested; the current conversation will finish first");
      return ControlResult.accepted(state.phase, "Run paused");
    } finally {
      lock.unlock();
    }
  }

  /** Continues a paused run. Accepted only while PAUSED. */
  public ControlResult resume() {
    lock.lock();
    try {
      if (state.phase != ExecutionPhase.PAUSED) {
        return invalidState("resume", null);
      }
      state.phase = ExecutionPhase.RUNNING;
      phaseChanged.signalAll();
      logAndPublish(LogLevel.INFO, "Run resumed");
      return ControlResult.accepted(state.phase, "Run resumed");
    } finally {
      lock.unlock();
    }
  }

  /** Requests a stop at the next turn or conversation boundary. Accepted while RUNNING or PAUSED. */
  public ControlResult stop() {
    lock.lock();
    try {
      if (state.phase != ExecutionPhase.RUNNING && state.phase != ExecutionPhase.PAUSED) {
        return invalidState("stop", null);
      }
      state.phase = ExecutionPhase.STOPPING;
      phaseChanged.signalAll();
      logAndPublish(LogLevel.WARNING, "Stop requested; remaining turns will not be sent");
      return ControlResult.accepted(state.phase, "Stop requested");
    } finally {
      lock.unlock();
    }
  }

  /** Discards a finished run and starts a new one from the uploaded test cases. */
  public ControlResult restart() {
    lock.lock();
    try {
      if (!state.phase.isTerminal()) {
        return invalidState("restart", null);
      }
      log.info("Restarting after run {} ended as {}", state.runId, state.phase);
      resetLocked();
      return startLocked();
    } finally {
      lock.unlock();
    }
  }

  /** Discards a finished run and returns to IDLE. */
  public ControlResult reset() {
    lock.lock();
    try {
      if (!state.phase.isTerminal()) {
        return invalidState("reset", null);
      }
      resetLocked();
      return ControlResult.accepted(state.phase, "Execution state reset");
    } finally {
      lock.unlock();
    }
  }

  private ControlResult startLocked() {
    if (!acceptingRuns.get()) {
      return ControlResult.rejected(
          state.phase, ControlError.INVALID_STATE, "Service is shutting down");
    }
    var rows = testCaseStore.getAll();
    var grouping = grouper.group(rows);
    if (!grouping.hasExecutableGroups()) {
      var message =
          rows.isEmpty()
              ? "No test cases uploaded"
              : "No valid conversation to execute ("
                  + grouping.validationErrors().size()
                  + " validation error(s))";
      log.warn("Start rejected: {}", message);
      return ControlResult.rejected(state.phase, ControlError.NO_EXECUTABLE_CASES, message);
    }

    var runId = newRunId();
    try {
      resultSink.open(runId);
    } catch (ResultSinkException ex) {
      log.error("Start rejected: {}", ex.getMessage(), ex);
      return ControlResult.rejected(state.phase, ControlError.SINK_UNAVAILABLE, ex.getMessage());
    }

    reporter.clear();
    state =
        ExecutionState.started(
            runId, grouping.totalTurns(), grouping.validationErrors(), clock.instant());
    reporter.log(
        LogLevel.INFO,
        "Run "
            + runId
            + " started: "
            + grouping.groups().size()
            + " conversation(s), "
            + grouping.totalTurns()
            + " turn(s)");
    grouping
        .validationErrors()
        .forEach(error -> reporter.log(LogLevel.WARNING, "Validation error: " + error));
    publish();

    var groups = grouping.groups();
    try {
      executor.execute(() -> runAll(runId, groups));
    } catch (RejectedExecutionException ex) {
      closeSink();
      state.phase = ExecutionPhase.ERROR;
      state.errorMessage = ex.getMessage();
      state.endTime = clock.instant();
      logAndPublish(LogLevel.ERROR, "Run could not be scheduled: " + ex.getMessage());
      return ControlResult.rejected(state.phase, ControlError.INVALID_STATE, ex.getMessage());
    }
    return ControlResult.accepted(state.phase, "Run " + runId + " started");
  }

  private void resetLocked() {
    state = ExecutionState.idle();
    reporter.clear();
    publish();
  }

  private ControlResult invalidState(String operation, String hint) {
    var message = "Cannot " + operation + " while " + state.phase.value();
    if (hint != null) {
      message += "; " + hint;
    }
    log.debug("Control operation rejected: {}", message);
    return ControlResult.rejected(state.phase, ControlError.INVALID_STATE, message);
  }

  // -----------------------------------------------------
  // Worker
  // -----------------------------------------------------

  private void runAll(String runId, List<ConversationGroup> groups) {
    log.info("Run {} worker started with {} conversation(s)", runId, groups.size());
    try {
      for (int i = 0; i < groups.size(); i++) {
        if (i > 0 && !pauseBetweenGroups()) {
          break;
        }
        if (!awaitGroupBoundary()) {
          break;
        }
        runGroup(groups.get(i), i + 1, groups.size());
      }
      finish();
    } catch (ResultSinkException ex) {
      fail("Result sink failure: " + ex.getMessage(), ex);
    } catch (RuntimeException ex) {
      fail("Unexpected error: " + ex.getMessage(), ex);
    }
  }

  private boolean pauseBetweenGroups() {
    try {
      pacer.pause(this::shouldContinue);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      requestStopAfterInterrupt();
      return false;
    }
  }

  /** Blocks while paused; returns true if the next conversation may start. */
  private boolean awaitGroupBoundary() {
    lock.lock();
    try {
      if (state.phase == ExecutionPhase.PAUSED) {
        logAndPublish(LogLevel.INFO, "Run paused");
      }
      while (state.phase == ExecutionPhase.PAUSED) {
        phaseChanged.await();
      }
      return state.phase == ExecutionPhase.RUNNING;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      state.phase = ExecutionPhase.STOPPING;
      logAndPublish(LogLevel.WARNING, "Run worker interrupted; stopping");
      return false;
    } finally {
      lock.unlock();
    }
  }

  private void requestStopAfterInterrupt() {
    lock.lock();
    try {
      if (state.phase == ExecutionPhase.RUNNING || state.phase == ExecutionPhase.PAUSED) {
        state.phase = ExecutionPhase.STOPPING;
        logAndPublish(LogLevel.WARNING, "Run worker interrupted; stopping");
      }
    } finally {
      lock.unlock();
    }
  }

  private boolean shouldContinue() {
    lock.lock();
    try {
      return state.phase != ExecutionPhase.STOPPING && !Thread.currentThread().isInterrupted();
    } finally {
      lock.unlock();
    }
  }

  private void runGroup(ConversationGroup group, int index, int groupCount) {
    lock.lock();
    try {
      logAndPublish(
          LogLevel.INFO,
          "Conversation "
              + group.getGroupId()
              + " started ("
              + index
              + "/"
              + groupCount
              + ", "
              + group.size()
              + " turn(s))");
    } finally {
      lock.unlock();
    }

    var outcome = runner.runGroup(group, chatClient, new RunListener(), this::shouldContinue);

    lock.lock();
    try {
      state.currentItem = null;
      if (outcome.cancelled()) {
        logAndPublish(
            LogLevel.WARNING, "Conversation " + group.getGroupId() + " cancelled by stop request");
      } else if (outcome.allSucceeded()) {
        logAndPublish(LogLevel.SUCCESS, "Conversation " + group.getGroupId() + " completed");
      } else {
        logAndPublish(LogLevel.ERROR, "Conversation " + group.getGroupId() + " ended with a failure");
      }
    } finally {
      lock.unlock();
    }
  }

  private void finish() {
    closeSink();
    lock.lock();
    try {
      var stopped = state.phase == ExecutionPhase.STOPPING;
      state.phase = stopped ? ExecutionPhase.STOPPED : ExecutionPhase.COMPLETED;
      state.endTime = clock.instant();
      state.currentItem = null;
      if (stopped) {
        reporter.log(
            LogLevel.WARNING,
            "Run stopped after " + state.completed + " of " + state.total + " turn(s)");
      } else {
        reporter.log(
            LogLevel.SUCCESS,
            String.format(
                Locale.ROOT,
                "Run completed: %d succeeded, %d failed, %d skipped (success rate %.1f%%)",
                state.succeeded, state.failed, state.skipped, state.successRate()));
      }
      addToHistory(state.toSummary());
      publish();
      log.info("Run {} ended as {}", state.runId, state.phase);
    } finally {
      lock.unlock();
    }
  }

  private void fail(String message, Exception cause) {
    log.error("Run failed: {}", message, cause);
    closeSink();
    lock.lock();
    try {
      state.phase = ExecutionPhase.ERROR;
      state.errorMessage = message;
      state.endTime = clock.instant();
      state.currentItem = null;
      reporter.log(LogLevel.ERROR, message);
      addToHistory(state.toSummary());
      publish();
    } finally {
      lock.unlock();
    }
  }

  private void closeSink() {
    try {
      resultSink.close();
    } catch (ResultSinkException ex) {
      log.warn("Failed to close result sink: {}", ex.getMessage());
    }
  }

  private void addToHistory(RunSummary summary) {
    runHistory.addFirst(summary);
    while (runHistory.size() > properties.getHistorySize()) {
      runHistory.pollLast();
    }
  }

  /** Must be called with the lock held. */
  private void logAndPublish(LogLevel level, String message) {
    reporter.log(level, message);
    publish();
  }

  /** Must be called with the lock held. */
  private void publish() {
    reporter.publish(state.toStatus(reporter.recentLogs()));
  }

  private String newRunId() {
    return "run-"
        + RUN_ID_FORMAT.format(clock.instant())
        + "-"
        + UUID.randomUUID().toString().substring(0, 8);
  }

  /** Feeds per-turn progress from the runner into the execution state. */
  private final class RunListener implements TurnCompletionListener {

    @Override
    public void onTurnStart(TestCase turn) {
      lock.lock();
      try {
        state.currentItem = turn.label();
        logAndPublish(LogLevel.INFO, "Turn " + turn.label() + " sending: " + turn.userMessage());
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void onRetry(TestCase turn, CallOutcome failedAttempt, Duration delay) {
      lock.lock();
      try {
        logAndPublish(
            LogLevel.WARNING,
            "Turn "
                + turn.label()
                + " attempt "
                + failedAttempt.attemptNumber()
                + " failed, retrying in "
                + delay.toSeconds()
                + "s: "
                + failedAttempt.errorDetail());
      } finally {
        lock.unlock();
      }
    }

    @Override
    public void onTurnComplete(ResultRecord record) {
      resultSink.append(record);
      lock.lock();
      try {
        state.record(record);
        var label = record.groupId() + "#" + record.turnNumber();
        switch (record.finalStatus()) {
          case SUCCESS -> reporter.log(
              LogLevel.SUCCESS,
              String.format(
                  Locale.ROOT,
                  "Turn %s succeeded in %.2fs (attempt %d)",
                  label,
                  record.latencySeconds(),
                  record.attempts()));
          case FAILED -> reporter.log(
              LogLevel.ERROR, "Turn " + label + " failed: " + record.errorDetail());
          case SKIPPED_DUE_TO_PRIOR_FAILURE -> reporter.log(
              LogLevel.WARNING, "Turn " + label + " skipped after an earlier failure");
          case CANCELLED -> reporter.log(LogLevel.WARNING, "Turn " + label + " cancelled");
        }
        publish();
      } finally {
        lock.unlock();
      }
    }
  }

  // -----------------------------------------------------
  // Read-only views
  // -----------------------------------------------------

  public ExecutionStatus getStatus() {
    return reporter.snapshot();
  }

  public List<LogEntry> getLogs(int limit) {
    return reporter.recentLogs(limit);
  }

  public List<LogEntry> getFullLog() {
    return reporter.fullLog();
  }

  /** Most recent finished runs first, up to the configured history size. */
  public List<RunSummary> getRunHistory() {
    return new ArrayList<>(runHistory);
  }

  /** Id of the current or last run, if any run has started since the last reset. */
  public Optional<String> getCurrentRunId() {
    return Optional.ofNullable(reporter.snapshot().runId());
  }

  public boolean isHealthy() {
    return acceptingRuns.get() && !executor.isShutdown();
  }

  /**
   * Stops accepting runs and asks an active run to stop. The worker finishes its in-flight turn.
   */
  public void shutdown() {
    if (acceptingRuns.compareAndSet(true, false)) {
      lock.lock();
      try {
        if (state.phase == ExecutionPhase.RUNNING || state.phase == ExecutionPhase.PAUSED) {
          state.phase = ExecutionPhase.STOPPING;
          phaseChanged.signalAll();
          logAndPublish(LogLevel.WARNING, "Service shutting down; stopping run");
        }
      } finally {
        lock.unlock();
      }
      executor.shutdown();
    }
  }

  @PreDestroy
  void onShutdown() {
    shutdown();
  }

  @VisibleForTesting
  boolean awaitWorkerIdle(Duration timeout) throws InterruptedException {
    var deadline = System.nanoTime() + timeout.toNanos();
    while (executor.getActiveCount() > 0 || !executor.getQueue().isEmpty()) {
      if (System.nanoTime() > deadline) {
        return false;
      }
      TimeUnit.MILLISECONDS.sleep(10);
    }
    return true;
  }
}
