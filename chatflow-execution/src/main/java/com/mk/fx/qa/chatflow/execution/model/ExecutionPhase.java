package com.mk.fx.qa.chatflow.execution.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ExecutionPhase {
  IDLE,
  RUNNING,
  PAUSED,
  STOPPING,
  STOPPED,
  COMPLETED,
  ERROR;

  /** True once a run has ended and only restart or reset are accepted. */
  public boolean isTerminal() {
    return this == STOPPED || this == COMPLETED || this == ERROR;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
