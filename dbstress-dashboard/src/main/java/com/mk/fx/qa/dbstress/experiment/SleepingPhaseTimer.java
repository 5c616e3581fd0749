package com.mk.fx.qa.dbstress.experiment;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/** Sleeps in short chunks so a stop request is noticed within {@value #SLEEP_CHUNK_MILLIS} ms. */
public final class SleepingPhaseTimer implements PhaseTimer {

  private static final long SLEEP_CHUNK_MILLIS = 100L;

  @Override
  public void await(Duration duration, BooleanSupplier stopRequested) throws InterruptedException {
    long remaining = duration.toMillis();
    while (remaining > 0) {
      if (Thread.currentThread().isInterrupted() || stopRequested.getAsBoolean()) {
        throw new InterruptedException("Stopped during phase");
      }
      var chunk = Math.min(SLEEP_CHUNK_MILLIS, remaining);
      TimeUnit.MILLISECONDS.sleep(chunk);
      remaining -= chunk;
    }
    if (stopRequested.getAsBoolean()) {
      throw new InterruptedException("Stopped at end of phase");
    }
  }
}
