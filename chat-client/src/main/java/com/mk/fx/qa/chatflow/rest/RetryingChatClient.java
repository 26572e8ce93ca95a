package com.mk.fx.qa.chatflow.rest;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes conversational turns through a {@link ResponseDelivery}, retrying failed attempts
 * according to a {@link RetryPolicy}. Never throws for call failures: every result, including
 * exhausted retries, is returned as a {@link CallOutcome}.
 */
@Slf4j
public class RetryingChatClient {

  private final ResponseDelivery delivery;
  private final RetryPolicy retryPolicy;
  private final String userId;
  private final Duration defaultTimeout;

  public RetryingChatClient(
      ResponseDelivery delivery, RetryPolicy retryPolicy, String userId, Duration defaultTimeout) {
    this.delivery = Objects.requireNonNull(delivery, "delivery");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.userId = Objects.requireNonNull(userId, "userId");
    this.defaultTimeout = defaultTimeout;
  }

  public ResponseMode mode() {
    return delivery.mode();
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /** Per-call timeout used when the caller does not pass one. */
  public Duration defaultTimeout() {
    return defaultTimeout;
  }

  public CallOutcome executeTurn(
      String sessionHandle, String message, Map<String, Object> extraInputs) {
    return executeTurn(sessionHandle, message, extraInputs, defaultTimeout, AttemptListener.NONE);
  }

  /**
   * Sends one turn, retrying transient failures.
   *
   * @param sessionHandle conversation handle from a previous turn, null for a new conversation
   * @param message user message
   * @param extraInputs additional workflow inputs, may be null
   * @param timeout per-attempt timeout, null for the transport default
   * @param listener notified of each failed attempt that will be retried
   * @return SUCCESS with the reply, or FATAL_FAILURE with the last error detail
   */
  public CallOutcome executeTurn(
      String sessionHandle,
      String message,
      Map<String, Object> extraInputs,
      Duration timeout,
      AttemptListener listener) {
    var request = new ChatRequest(message, userId, sessionHandle, extraInputs, timeout);
    var attemptListener = listener != null ? listener : AttemptListener.NONE;
    var maxAttempts = retryPolicy.maxAttempts();

    for (int attempt = 1; ; attempt++) {
      var startTime = System.nanoTime();
      try {
        var reply = delivery.deliver(request);
        var handle = reply.conversationId() != null ? reply.conversationId() : sessionHandle;
        if (attempt > 1) {
          log.info("Call succeeded on attempt {}/{}", attempt, maxAttempts);
        }
        return CallOutcome.success(reply.answer(), handle, reply.latency(), attempt);
      } catch (ChatApiException ex) {
        var latency = Duration.ofNanos(System.nanoTime() - startTime);
        if (!retryPolicy.isRetryable(ex)) {
          log.warn("Call failed with non-retryable {} error: {}", ex.getKind(), ex.getMessage());
          return CallOutcome.fatalFailure(ex.getMessage(), latency, attempt);
        }
        if (attempt >= maxAttempts) {
          log.warn("Call failed after {} attempts: {}", attempt, ex.getMessage());
          return CallOutcome.fatalFailure(
              "Failed after " + attempt + " attempts: " + ex.getMessage(), latency, attempt);
        }

        var failedAttempt = CallOutcome.retryableFailure(ex.getMessage(), latency, attempt);
        log.warn(
            "Call attempt {}/{} failed ({}), retrying in {} ms: {}",
            attempt,
            maxAttempts,
            ex.getKind(),
            retryPolicy.delay().toMillis(),
            ex.getMessage());
        attemptListener.onRetry(failedAttempt, retryPolicy.delay());

        if (!pause(retryPolicy.delay())) {
          return CallOutcome.fatalFailure(
              "Interrupted while waiting to retry: " + ex.getMessage(), latency, attempt);
        }
      }
    }
  }

  private boolean pause(Duration delay) {
    if (delay.isZero()) {
      return true;
    }
    try {
      TimeUnit.MILLISECONDS.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
