package com.mk.fx.qa.chatflow.rest;

/** Which failures consume retry budget. */
public enum RetryClassification {
  /** Only transient failures are retried; client errors fail immediately. */
  CLASSIFIED,
  /** Every failure is retried until the budget is spent. */
  BLANKET
}
