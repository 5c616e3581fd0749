package com.mk.fx.qa.dbstress.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.dbstress.experiment.VariantId;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.telemetry.LenientNumberReader;
import com.mk.fx.qa.dbstress.telemetry.SystemSnapshot;
import com.mk.fx.qa.dbstress.telemetry.TelemetryFrameParser;
import com.mk.fx.qa.dbstress.telemetry.WaitEvent;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns engine push payloads into {@link EngineEvent}s.
 *
 * <p>Numeric fields are read leniently: bad values become zero and are counted, the event is
 * still produced. Only a payload that cannot identify what it refers to (a progress event with no
 * id, a sample with no variant) is rejected with {@link IllegalArgumentException}.
 */
@Slf4j
public class EngineEventParser {

  private final LenientNumberReader numbers;
  private final TelemetryFrameParser frames;
  private final Clock clock;

  public EngineEventParser(LenientNumberReader numbers, Clock clock) {
    this.numbers = numbers;
    this.frames = new TelemetryFrameParser(numbers);
    this.clock = clock;
  }

  public EngineEvent parse(EngineEventType type, JsonNode payload) {
    return switch (type) {
      case TELEMETRY -> telemetry(payload);
      case PROGRESS -> progress(payload);
      case SYSTEM -> system(payload);
      case EXPERIMENT_SAMPLE -> experimentSample(payload);
      case WORKLOAD_STOPPED -> workloadStopped(payload);
    };
  }

  TelemetryEvent telemetry(JsonNode payload) {
    return new TelemetryEvent(frames.parse(payload, clock.instant()));
  }

  OperationProgressEvent progress(JsonNode payload) {
    var id = firstText(payload, "schemaId", "id", "prefix");
    if (id == null) {
      throw new IllegalArgumentException("Progress event carries no schemaId");
    }
    var step = payload.hasNonNull("step") ? payload.get("step").asText() : null;
    return new OperationProgressEvent(EntityKey.of(id), step, numbers.readInt(payload, "progress"));
  }

  SystemSnapshotEvent system(JsonNode payload) {
    List<WaitEvent> waitEvents = new ArrayList<>();
    var events = payload == null ? null : payload.get("waitEvents");
    if (events != null && events.isArray()) {
      int i = 0;
      for (var node : events) {
        var path = "waitEvents[" + i++ + "].";
        waitEvents.add(
            new WaitEvent(
                text(node, "event"),
                text(node, "waitClass"),
                numbers.readDouble(node, "totalWaits", path + "totalWaits"),
                numbers.readDouble(node, "timeWaitedSeconds", path + "timeWaitedSeconds"),
                numbers.readDouble(node, "averageWaitMs", path + "averageWaitMs")));
      }
    }
    return new SystemSnapshotEvent(
        new SystemSnapshot(
            clock.instant(),
            waitEvents,
            numericFields(payload, "systemStats"),
            numericFields(payload, "sessionStats")));
  }

  ExperimentSampleEvent experimentSample(JsonNode payload) {
    var variant = firstText(payload, "variant", "run");
    if (variant == null) {
      throw new IllegalArgumentException("Experiment sample carries no variant");
    }
    var throughput =
        numbers.has(payload, "throughput")
            ? numbers.readDouble(payload, "throughput")
            : numbers.readDouble(payload, "tps");
    var responseTime =
        numbers.has(payload, "responseTimeMs")
            ? numbers.readDouble(payload, "responseTimeMs")
            : numbers.readDouble(payload, "avgResponseTime");
    Double efficiency =
        numbers.has(payload, "efficiency") ? numbers.readDouble(payload, "efficiency") : null;
    return new ExperimentSampleEvent(
        VariantId.fromValue(variant), throughput, responseTime, efficiency, clock.instant());
  }

  WorkloadStoppedEvent workloadStopped(JsonNode payload) {
    List<EntityKey> keys = new ArrayList<>();
    var schemas = payload == null ? null : payload.get("schemas");
    if (schemas != null && schemas.isArray()) {
      schemas.forEach(node -> keys.add(EntityKey.of(node.asText())));
    } else if (payload != null && payload.has("prefix")) {
      keys.add(EntityKey.of(payload.get("prefix").asText()));
    }

    var stats = payload != null && payload.has("finalStats") ? payload.get("finalStats") : payload;
    Map<EntityKey, Map<String, Double>> finalTotals = new LinkedHashMap<>();
    var perSchema = stats == null ? null : stats.get("schemas");
    if (perSchema != null && perSchema.isObject()) {
      var it = perSchema.fields();
      while (it.hasNext()) {
        var entry = it.next();
        var key = EntityKey.of(entry.getKey());
        var totals = totals(entry.getValue(), "finalStats.schemas." + key);
        if (!totals.isEmpty()) {
          finalTotals.put(key, totals);
        }
      }
    } else {
      var totals = totals(stats, "finalStats");
      if (!totals.isEmpty()) {
        finalTotals.put(keys.size() == 1 ? keys.get(0) : EntityKey.DEFAULT, totals);
      }
    }
    return new WorkloadStoppedEvent(keys, finalTotals, numbers.readDouble(stats, "duration"));
  }

  // the counters may sit directly on the node or under "total"
  private Map<String, Double> totals(JsonNode node, String path) {
    Map<String, Double> totals = new LinkedHashMap<>();
    if (node == null || !node.isObject()) {
      return totals;
    }
    var source = node.has("total") && node.get("total").isObject() ? node.get("total") : node;
    for (var field : TelemetryFrameParser.TOTAL_FIELDS) {
      if (numbers.has(source, field)) {
        totals.put(field, numbers.readDouble(source, field, path + "." + field));
      }
    }
    return totals;
  }

  private Map<String, Double> numericFields(JsonNode payload, String field) {
    Map<String, Double> values = new LinkedHashMap<>();
    var node = payload == null ? null : payload.get(field);
    if (node == null || !node.isObject()) {
      return values;
    }
    var it = node.fieldNames();
    while (it.hasNext()) {
      var name = it.next();
      values.put(name, numbers.readDouble(node, name, field + "." + name));
    }
    return values;
  }

  private static String firstText(JsonNode payload, String... fields) {
    if (payload == null) {
      return null;
    }
    for (var field : fields) {
      if (payload.hasNonNull(field) && !payload.get(field).asText().isBlank()) {
        return payload.get(field).asText();
      }
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    return node != null && node.hasNonNull(field) ? node.get(field).asText() : "";
  }
}
