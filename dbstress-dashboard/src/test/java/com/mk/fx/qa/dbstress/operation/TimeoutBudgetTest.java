package com.mk.fx.qa.dbstress.operation;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TimeoutBudgetTest {

  private final TimeoutBudget budget = TimeoutBudget.ofMillis(60_000, 30_000, 300_000);

  @Test
  void forUnits_growsLinearlyWithUnits() {
    assertEquals(Duration.ofMillis(60_000), budget.forUnits(0));
    assertEquals(Duration.ofMillis(90_000), budget.forUnits(1));
    assertEquals(Duration.ofMillis(180_000), budget.forUnits(4));
  }

  @Test
  void forUnits_isCappedAtHardCap() {
    assertEquals(Duration.ofMillis(300_000), budget.forUnits(8));
    assertEquals(Duration.ofMillis(300_000), budget.forUnits(1_000));
  }

  @Test
  void forUnits_overflowIsCapped() {
    var huge =
        new TimeoutBudget(
            Duration.ofMillis(1), Duration.ofMillis(Long.MAX_VALUE / 2), Duration.ofHours(1));

    assertEquals(Duration.ofHours(1), huge.forUnits(Integer.MAX_VALUE));
  }

  @Test
  void forUnits_negativeUnitsCountAsZero() {
    assertEquals(Duration.ofMillis(60_000), budget.forUnits(-3));
  }

  @Test
  void constructor_rejectsZeroHardCap() {
    assertThrows(IllegalArgumentException.class, () -> TimeoutBudget.ofMillis(1, 1, 0));
  }
}
