package com.mk.fx.qa.chatflow.execution.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.mk.fx.qa.chatflow.rest.CallOutcome;
import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one turn as written to the result sink.
 *
 * @param latencySeconds duration of the final attempt, null when the turn was never sent
 * @param sessionHandle remote conversation id in effect after the turn
 * @param attempts calls made for this turn, 0 when it was never sent
 */
public record ResultRecord(
    String groupId,
    int turnNumber,
    String userMessage,
    String expectedReply,
    Map<String, Object> extraInputs,
    String actualReply,
    Double latencySeconds,
    FinalStatus finalStatus,
    String errorDetail,
    Instant completedAt,
    String sessionHandle,
    int attempts) {

  /**
   * Builds the record of a turn that was sent.
   *
   * @param currentSession session in effect before the call, kept when the outcome carries none
   */
  public static ResultRecord fromOutcome(
      TestCase turn, CallOutcome outcome, String currentSession, Instant completedAt) {
    var latency = outcome.latency() != null ? outcome.latency().toNanos() / 1_000_000_000.0 : null;
    return new ResultRecord(
        turn.groupId(),
        turn.turnNumber(),
        turn.userMessage(),
        turn.expectedReply(),
        turn.extraInputs(),
        outcome.isSuccess() ? outcome.replyText() : null,
        latency,
        outcome.isSuccess() ? FinalStatus.SUCCESS : FinalStatus.FAILED,
        outcome.errorDetail(),
        completedAt,
        outcome.sessionHandle() != null ? outcome.sessionHandle() : currentSession,
        outcome.attemptNumber());
  }

  public static ResultRecord skipped(TestCase turn, String reason, Instant completedAt) {
    return notSent(turn, FinalStatus.SKIPPED_DUE_TO_PRIOR_FAILURE, reason, completedAt);
  }

  public static ResultRecord cancelled(TestCase turn, Instant completedAt) {
    return notSent(turn, FinalStatus.CANCELLED, "Run stopped before this turn", completedAt);
  }

  private static ResultRecord notSent(
      TestCase turn, FinalStatus status, String detail, Instant completedAt) {
    return new ResultRecord(
        turn.groupId(),
        turn.turnNumber(),
        turn.userMessage(),
        turn.expectedReply(),
        turn.extraInputs(),
        null,
        null,
        status,
        detail,
        completedAt,
        null,
        0);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return finalStatus == FinalStatus.SUCCESS;
  }
}
