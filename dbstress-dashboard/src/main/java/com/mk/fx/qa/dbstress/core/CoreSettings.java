package com.mk.fx.qa.dbstress.core;

import com.mk.fx.qa.dbstress.operation.TimeoutBudget;
import com.mk.fx.qa.dbstress.series.BoundedSeriesStore;

public record CoreSettings(int seriesCapacity, int eventQueueCapacity, TimeoutBudget operationBudget) {

  public static final int DEFAULT_EVENT_QUEUE_CAPACITY = 1_000;

  public static CoreSettings defaults() {
    return new CoreSettings(
        BoundedSeriesStore.DEFAULT_CAPACITY,
        DEFAULT_EVENT_QUEUE_CAPACITY,
        TimeoutBudget.ofMillis(60_000, 30_000, 600_000));
  }
}
