package com.mk.fx.qa.chatflow.execution.model;

/**
 * Latency figures cover attempted turns only; skipped and cancelled turns have no latency.
 *
 * @param successRate succeeded records as a percentage of all records written
 */
public record Statistics(
    Double minLatencySeconds,
    Double avgLatencySeconds,
    Double maxLatencySeconds,
    double successRate) {

  public static Statistics empty() {
    return new Statistics(null, null, null, 0.0);
  }
}
