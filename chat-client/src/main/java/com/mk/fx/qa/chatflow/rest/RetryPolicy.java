package com.mk.fx.qa.chatflow.rest;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded retry with a fixed delay between attempts.
 *
 * @param maxRetries retries after the first attempt
 * @param delay pause between attempts
 * @param classification which failures are retried
 */
public record RetryPolicy(int maxRetries, Duration delay, RetryClassification classification) {

  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_DELAY = Duration.ofSeconds(5);

  public RetryPolicy {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    Objects.requireNonNull(delay, "delay");
    if (delay.isNegative()) {
      throw new IllegalArgumentException("delay must not be negative");
    }
    Objects.requireNonNull(classification, "classification");
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_DELAY, RetryClassification.CLASSIFIED);
  }

  public int maxAttempts() {
    return maxRetries + 1;
  }

  public boolean isRetryable(ChatApiException failure) {
    if (failure.getKind() == ChatApiException.Kind.INTERRUPTED) {
      return false;
    }
    return classification == RetryClassification.BLANKET || failure.isRetryable();
  }
}
