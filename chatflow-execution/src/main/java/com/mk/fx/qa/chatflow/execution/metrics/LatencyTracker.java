package com.mk.fx.qa.chatflow.execution.metrics;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks running min/max/sum of turn latencies in a thread-safe manner. Values are kept in
 * microseconds and reported in seconds.
 */
public final class LatencyTracker {

  private static final double MICROS_PER_SECOND = 1_000_000.0;

  private final AtomicLong min = new AtomicLong(Long.MAX_VALUE);
  private final AtomicLong max = new AtomicLong(Long.MIN_VALUE);
  private final AtomicLong sum = new AtomicLong();
  private final AtomicLong count = new AtomicLong();

  public void record(double latencySeconds) {
    long v = Math.max(0, Math.round(latencySeconds * MICROS_PER_SECOND));
    sum.addAndGet(v);
    count.incrementAndGet();
    max.accumulateAndGet(v, Math::max);
    min.accumulateAndGet(v, Math::min);
  }

  public long count() {
    return count.get();
  }

  public Optional<Double> minSeconds() {
    long v = min.get();
    return v == Long.MAX_VALUE ? Optional.empty() : Optional.of(v / MICROS_PER_SECOND);
  }

  public Optional<Double> maxSeconds() {
    long v = max.get();
    return v == Long.MIN_VALUE ? Optional.empty() : Optional.of(v / MICROS_PER_SECOND);
  }

  public Optional<Double> avgSeconds() {
    long n = count.get();
    return n == 0 ? Optional.empty() : Optional.of(sum.get() / MICROS_PER_SECOND / n);
  }
}
