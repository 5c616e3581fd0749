package com.mk.fx.qa.dbstress.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads numeric fields from engine payloads without ever rejecting the payload. Numbers and
 * numeric strings (the engine formats some averages as {@code "12.50"}) are accepted; a missing
 * or null field reads as zero; anything else reads as zero and is recorded as malformed.
 */
@Slf4j
public final class LenientNumberReader {

  private final MalformedFieldTracker tracker;

  public LenientNumberReader(MalformedFieldTracker tracker) {
    this.tracker = tracker;
  }

  public double readDouble(JsonNode parent, String field) {
    return readDouble(parent, field, field);
  }

  /**
   * @param parent object holding the field, may be null
   * @param field field name inside {@code parent}
   * @param path dotted path used when recording a malformed value
   */
  public double readDouble(JsonNode parent, String field, String path) {
    if (parent == null || !parent.isObject()) {
      return 0.0;
    }
    var node = parent.get(field);
    if (node == null || node.isNull() || node.isMissingNode()) {
      return 0.0;
    }
    if (node.isNumber()) {
      return sanitise(node.doubleValue(), path, node);
    }
    if (node.isTextual()) {
      try {
        return sanitise(Double.parseDouble(node.asText().trim()), path, node);
      } catch (NumberFormatException ex) {
        return malformed(path, node);
      }
    }
    return malformed(path, node);
  }

  public int readInt(JsonNode parent, String field) {
    return (int) Math.round(readDouble(parent, field));
  }

  public boolean has(JsonNode parent, String field) {
    return parent != null && parent.hasNonNull(field);
  }

  /** Records a field the caller had to discard for a reason other than its number format. */
  void recordMalformed(String path, String rawValue) {
    tracker.record(path, rawValue);
  }

  private double sanitise(double value, String path, JsonNode raw) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return malformed(path, raw);
    }
    return value;
  }

  private double malformed(String path, JsonNode raw) {
    var text = raw.toString();
    log.warn("Malformed numeric field '{}' with value {} defaulted to 0", path, text);
    tracker.record(path, text);
    return 0.0;
  }
}
