package com.mk.fx.qa.dbstress.experiment;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/** Waits out one experiment phase. */
@FunctionalInterface
public interface PhaseTimer {

  /**
   * Blocks for {@code duration}.
   *
   * @throws InterruptedException when {@code stopRequested} turns true or the thread is interrupted
   */
  void await(Duration duration, BooleanSupplier stopRequested) throws InterruptedException;
}
