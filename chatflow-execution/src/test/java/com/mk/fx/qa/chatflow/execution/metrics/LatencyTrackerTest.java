package com.mk.fx.qa.chatflow.execution.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class LatencyTrackerTest {

  @Test
  void emptyTrackerHasNoStatistics() {
    var tracker = new LatencyTracker();

    assertThat(tracker.count()).isZero();
    assertThat(tracker.minSeconds()).isEmpty();
    assertThat(tracker.maxSeconds()).isEmpty();
    assertThat(tracker.avgSeconds()).isEmpty();
  }

  @Test
  void tracksMinMaxAndAverage() {
    var tracker = new LatencyTracker();
    tracker.record(0.5);
    tracker.record(1.5);
    tracker.record(1.0);

    assertThat(tracker.count()).isEqualTo(3);
    assertThat(tracker.minSeconds()).contains(0.5);
    assertThat(tracker.maxSeconds()).contains(1.5);
    assertThat(tracker.avgSeconds().orElseThrow()).isCloseTo(1.0, within(1e-9));
  }
}
