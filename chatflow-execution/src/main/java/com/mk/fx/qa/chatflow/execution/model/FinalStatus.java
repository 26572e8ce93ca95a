package com.mk.fx.qa.chatflow.execution.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Terminal status of one executed (or not executed) turn. */
public enum FinalStatus {
  SUCCESS("success"),
  FAILED("failed"),
  SKIPPED_DUE_TO_PRIOR_FAILURE("skipped_due_to_prior_failure"),
  CANCELLED("cancelled");

  private final String value;

  FinalStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static FinalStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown final status: " + value));
  }
}
