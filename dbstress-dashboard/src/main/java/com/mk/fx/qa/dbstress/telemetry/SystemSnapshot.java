package com.mk.fx.qa.dbstress.telemetry;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Latest unkeyed database view: top wait events plus system and session statistics. */
public record SystemSnapshot(
    Instant timestamp,
    List<WaitEvent> waitEvents,
    Map<String, Double> systemStats,
    Map<String, Double> sessionStats) {

  public SystemSnapshot {
    waitEvents = waitEvents == null ? List.of() : List.copyOf(waitEvents);
    systemStats = systemStats == null ? Map.of() : Map.copyOf(systemStats);
    sessionStats = sessionStats == null ? Map.of() : Map.copyOf(sessionStats);
  }
}
