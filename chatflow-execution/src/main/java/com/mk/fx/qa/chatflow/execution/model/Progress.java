package com.mk.fx.qa.chatflow.execution.model;

/**
 * Run progress counted in turns.
 *
 * @param completed records written so far, whatever their status
 * @param currentItem label of the turn being executed, null between turns
 */
public record Progress(
    int total,
    int completed,
    int succeeded,
    int failed,
    int skipped,
    int cancelled,
    String currentItem) {

  public static Progress empty() {
    return new Progress(0, 0, 0, 0, 0, 0, null);
  }
}
