package com.mk.fx.qa.dbstress.telemetry;

import java.util.Map;

/** Per-entity figures extracted from one telemetry payload. */
public record EntityTelemetry(
    double throughput,
    double inserts,
    double updates,
    double deletes,
    double selects,
    Map<String, Double> totals) {

  public EntityTelemetry {
    totals = totals == null ? Map.of() : Map.copyOf(totals);
  }
}
