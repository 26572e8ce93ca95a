package com.mk.fx.qa.chatflow.execution.model;

/**
 * Answer to a control operation. Rejected operations leave the execution state unchanged.
 *
 * @param phase phase after the operation
 * @param error rejection reason, null on success
 */
public record ControlResult(
    boolean success, ExecutionPhase phase, String message, ControlError error) {

  public static ControlResult accepted(ExecutionPhase phase, String message) {
    return new ControlResult(true, phase, message, null);
  }

  public static ControlResult rejected(ExecutionPhase phase, ControlError error, String message) {
    return new ControlResult(false, phase, message, error);
  }
}
