package com.mk.fx.qa.chatflow.rest;

import java.time.Duration;

/** Notified when an attempt failed and another one is about to be made. */
@FunctionalInterface
public interface AttemptListener {

  AttemptListener NONE = (failedAttempt, delay) -> {};

  void onRetry(CallOutcome failedAttempt, Duration delay);
}
