package com.mk.fx.qa.dbstress.model;

import java.util.Arrays;
import java.util.List;

/** Keyed telemetry dimensions kept as bounded series. */
public enum Channel {
  THROUGHPUT(List.of("tps")),
  OPERATIONS(List.of("inserts", "updates", "deletes", "selects"));

  private final List<String> fields;

  Channel(List<String> fields) {
    this.fields = fields;
  }

  public List<String> fields() {
    return fields;
  }

  public static Channel fromValue(String value) {
    return Arrays.stream(values())
        .filter(channel -> channel.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported channel: " + value));
  }
}
