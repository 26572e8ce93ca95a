package com.mk.fx.qa.chatflow.execution.runner;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Fixed pause between consecutive calls. The wait is split into short chunks so that a stop
 * request ends it early.
 */
public class TurnPacer {

  private static final long SLEEP_CHUNK_MILLIS = 200L;

  private final long intervalMillis;

  public TurnPacer(Duration interval) {
    this.intervalMillis = interval != null ? Math.max(0, interval.toMillis()) : 0;
  }

  public static TurnPacer none() {
    return new TurnPacer(Duration.ZERO);
  }

  public boolean isEnabled() {
    return intervalMillis > 0;
  }

  /**
   * Waits for the configured interval.
   *
   * @param keepGoing polled between chunks
   * @return false if {@code keepGoing} turned false before the interval elapsed
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  public boolean pause(BooleanSupplier keepGoing) throws InterruptedException {
    var remaining = intervalMillis;
    while (remaining > 0) {
      if (!keepGoing.getAsBoolean()) {
        return false;
      }
      var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
      TimeUnit.MILLISECONDS.sleep(chunk);
      remaining -= chunk;
    }
    return keepGoing.getAsBoolean();
  }
}
