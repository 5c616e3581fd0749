package com.mk.fx.qa.dbstress.event;

import java.util.Arrays;

/** Push endpoints exposed to the engine, by path segment. */
public enum EngineEventType {
  TELEMETRY("telemetry"),
  PROGRESS("progress"),
  SYSTEM("system"),
  EXPERIMENT_SAMPLE("experiment-sample"),
  WORKLOAD_STOPPED("workload-stopped");

  private final String path;

  EngineEventType(String path) {
    this.path = path;
  }

  public String path() {
    return path;
  }

  public static EngineEventType fromPath(String value) {
    return Arrays.stream(values())
        .filter(type -> type.path.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown engine event type: " + value));
  }
}
