package com.mk.fx.qa.dbstress.operation;

import java.time.Duration;

/**
 * Maximum wait for a size-dependent operation: {@code min(base + units * perUnit, hardCap)}.
 */
public record TimeoutBudget(Duration base, Duration perUnit, Duration hardCap) {

  public TimeoutBudget {
    if (base.isNegative() || perUnit.isNegative() || hardCap.isNegative() || hardCap.isZero()) {
      throw new IllegalArgumentException("Timeout budget components must be positive");
    }
  }

  public static TimeoutBudget ofMillis(long baseMs, long perUnitMs, long hardCapMs) {
    return new TimeoutBudget(
        Duration.ofMillis(baseMs), Duration.ofMillis(perUnitMs), Duration.ofMillis(hardCapMs));
  }

  public Duration forUnits(int unitCount) {
    long units = Math.max(0, unitCount);
    long millis;
    try {
      millis = Math.addExact(base.toMillis(), Math.multiplyExact(units, perUnit.toMillis()));
    } catch (ArithmeticException overflow) {
      millis = Long.MAX_VALUE;
    }
    return Duration.ofMillis(Math.min(millis, hardCap.toMillis()));
  }
}
