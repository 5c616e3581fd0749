package com.mk.fx.qa.dbstress.telemetry;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.dbstress.model.EntityKey;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Decodes both telemetry wire shapes.
 *
 * <p>Legacy: {@code {tps, perSecond: {inserts, updates, deletes, selects, transactions, errors},
 * total: {...}}} for the default entity. Current: {@code {timestamp, schemas: {KEY: <legacy
 * payload>, ...}}}. Key order follows the wire.
 */
@Slf4j
public final class TelemetryFrameParser {

  static final String SCHEMAS = "schemas";
  public static final List<String> TOTAL_FIELDS =
      List.of("inserts", "updates", "deletes", "selects", "transactions", "errors");

  private final LenientNumberReader numbers;

  public TelemetryFrameParser(LenientNumberReader numbers) {
    this.numbers = numbers;
  }

  public TelemetryFrame parse(JsonNode payload, Instant receivedAt) {
    var timestamp = readTimestamp(payload, receivedAt);
    if (payload == null || !payload.isObject()) {
      log.warn("Telemetry payload is not an object, ignoring: {}", payload);
      return new TelemetryFrame(timestamp, TelemetryFrame.Shape.LEGACY, Map.of());
    }

    if (payload.has(SCHEMAS)) {
      Map<EntityKey, EntityTelemetry> entities = new LinkedHashMap<>();
      var schemas = payload.get(SCHEMAS);
      if (schemas != null && schemas.isObject()) {
        var it = schemas.fields();
        while (it.hasNext()) {
          var entry = it.next();
          var key = EntityKey.of(entry.getKey());
          if (entities.containsKey(key)) {
            log.warn(
                "Telemetry key '{}' normalises to {} which is already present, payload dropped",
                entry.getKey(),
                key);
            numbers.recordMalformed(SCHEMAS + "." + key, entry.getKey());
            continue;
          }
          entities.put(key, readEntity(entry.getValue(), SCHEMAS + "." + key));
        }
      } else {
        log.warn("Telemetry 'schemas' field is not an object, ignoring: {}", schemas);
      }
      return new TelemetryFrame(timestamp, TelemetryFrame.Shape.MULTI_ENTITY, entities);
    }

    return new TelemetryFrame(
        timestamp,
        TelemetryFrame.Shape.LEGACY,
        Map.of(EntityKey.DEFAULT, readEntity(payload, "")));
  }

  private EntityTelemetry readEntity(JsonNode node, String prefix) {
    var perSecond = node == null ? null : node.get("perSecond");
    var total = node == null ? null : node.get("total");
    var p = prefix.isEmpty() ? "" : prefix + ".";

    double tps =
        numbers.has(node, "tps")
            ? numbers.readDouble(node, "tps", p + "tps")
            : numbers.readDouble(perSecond, "transactions", p + "perSecond.transactions");

    Map<String, Double> totals = new HashMap<>();
    for (var field : TOTAL_FIELDS) {
      totals.put(field, numbers.readDouble(total, field, p + "total." + field));
    }

    return new EntityTelemetry(
        tps,
        numbers.readDouble(perSecond, "inserts", p + "perSecond.inserts"),
        numbers.readDouble(perSecond, "updates", p + "perSecond.updates"),
        numbers.readDouble(perSecond, "deletes", p + "perSecond.deletes"),
        numbers.readDouble(perSecond, "selects", p + "perSecond.selects"),
        totals);
  }

  private Instant readTimestamp(JsonNode payload, Instant fallback) {
    if (payload != null && payload.hasNonNull("timestamp") && payload.get("timestamp").isNumber()) {
      long millis = payload.get("timestamp").asLong();
      if (millis > 0) {
        return Instant.ofEpochMilli(millis);
      }
    }
    return fallback;
  }
}
