package com.mk.fx.qa.chatflow.execution.model;

/** Why a control operation was rejected. */
public enum ControlError {
  /** The operation is not allowed in the current phase. */
  INVALID_STATE,
  /** No uploaded conversation passed validation. */
  NO_EXECUTABLE_CASES,
  /** The result file for a new run could not be created. */
  SINK_UNAVAILABLE
}
