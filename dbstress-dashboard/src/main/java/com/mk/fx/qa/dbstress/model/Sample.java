package com.mk.fx.qa.dbstress.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/** One telemetry tick for one channel. Fields absent from the map read as zero. */
public record Sample(Instant timestamp, Map<String, Double> fields) {

  public Sample {
    Objects.requireNonNull(timestamp, "timestamp");
    fields = fields == null ? Map.of() : Map.copyOf(fields);
  }

  public double field(String name) {
    return fields.getOrDefault(name, 0.0);
  }
}
