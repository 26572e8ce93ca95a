package com.mk.fx.qa.chatflow.rest;

import java.time.Duration;

/**
 * Result of executing one conversational turn, or of one failed attempt at it.
 *
 * @param status success, retryable failure (intermediate attempt) or fatal failure
 * @param replyText reply text on success, otherwise null
 * @param sessionHandle conversation handle to use for the next turn, may be null
 * @param latency duration of the reported attempt
 * @param errorDetail failure description, null on success
 * @param attemptNumber 1-based attempt that produced this outcome
 */
public record CallOutcome(
    CallStatus status,
    String replyText,
    String sessionHandle,
    Duration latency,
    String errorDetail,
    int attemptNumber) {

  public static CallOutcome success(
      String replyText, String sessionHandle, Duration latency, int attemptNumber) {
    return new CallOutcome(
        CallStatus.SUCCESS, replyText, sessionHandle, latency, null, attemptNumber);
  }

  public static CallOutcome retryableFailure(
      String errorDetail, Duration latency, int attemptNumber) {
    return new CallOutcome(
        CallStatus.RETRYABLE_FAILURE, null, null, latency, errorDetail, attemptNumber);
  }

  public static CallOutcome fatalFailure(String errorDetail, Duration latency, int attemptNumber) {
    return new CallOutcome(
        CallStatus.FATAL_FAILURE, null, null, latency, errorDetail, attemptNumber);
  }

  public boolean isSuccess() {
    return status == CallStatus.SUCCESS;
  }
}
