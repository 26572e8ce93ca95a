package com.mk.fx.qa.chatflow.execution.runner;

import com.mk.fx.qa.chatflow.execution.model.ResultRecord;
import com.mk.fx.qa.chatflow.execution.model.TestCase;
import com.mk.fx.qa.chatflow.rest.CallOutcome;
import java.time.Duration;

/**
 * Receives the progress of a conversation. Called synchronously on the runner thread; the runner
 * does not move on until {@link #onTurnComplete} returns, and an exception thrown from it aborts
 * the conversation.
 */
@FunctionalInterface
public interface TurnCompletionListener {

  void onTurnComplete(ResultRecord record);

  default void onTurnStart(TestCase turn) {}

  default void onRetry(TestCase turn, CallOutcome failedAttempt, Duration delay) {}
}
