package com.mk.fx.qa.dbstress.telemetry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts fields that could not be read as numbers. Such fields are defaulted to zero by the
 * readers and the rest of the event is still applied; this tracker keeps the evidence.
 */
public final class MalformedFieldTracker {
  private static final int MAX_SAMPLES = 5;

  private final AtomicLong totalMalformed = new AtomicLong();
  private final Map<String, AtomicLong> breakdown = new ConcurrentHashMap<>();
  private final List<MalformedField> samples = new CopyOnWriteArrayList<>();

  /** One recorded malformed field with its raw text. */
  public record MalformedField(String field, String rawValue) {}

  void record(String field, String rawValue) {
    totalMalformed.incrementAndGet();
    String key = field == null || field.isBlank() ? "UNKNOWN" : field;
    breakdown.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    if (samples.size() < MAX_SAMPLES) {
      samples.add(new MalformedField(key, rawValue));
    }
  }

  public long totalMalformed() {
    return totalMalformed.get();
  }

  public Map<String, Long> breakdownSnapshot() {
    Map<String, Long> map = new HashMap<>();
    for (var e : breakdown.entrySet()) map.put(e.getKey(), e.getValue().get());
    return Map.copyOf(map);
  }

  public List<MalformedField> samplesSnapshot() {
    return List.copyOf(samples);
  }
}
