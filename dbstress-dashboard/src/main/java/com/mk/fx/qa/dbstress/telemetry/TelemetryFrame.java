package com.mk.fx.qa.dbstress.telemetry;

import com.mk.fx.qa.dbstress.model.EntityKey;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A decoded telemetry push. {@code entities} keeps the order in which keys appeared on the wire;
 * a {@link Shape#LEGACY} frame carries exactly one entry under {@link EntityKey#DEFAULT}.
 */
public record TelemetryFrame(Instant timestamp, Shape shape, Map<EntityKey, EntityTelemetry> entities) {

  public enum Shape {
    LEGACY,
    MULTI_ENTITY
  }

  public TelemetryFrame {
    entities = Collections.unmodifiableMap(new LinkedHashMap<>(entities));
  }

  public boolean isEmpty() {
    return entities.isEmpty();
  }
}
