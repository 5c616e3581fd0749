package com.mk.fx.qa.dbstress.event;

import com.mk.fx.qa.dbstress.model.EntityKey;
import java.util.List;
import java.util.Map;

/**
 * The engine's workers ended. An empty key list means every workload stopped.
 *
 * <p>{@code finalTotals} holds the cumulative counters the engine reported on stop, per key. Totals
 * that could not be attributed to a named key are filed under {@link EntityKey#DEFAULT}.
 */
public record WorkloadStoppedEvent(
    List<EntityKey> keys, Map<EntityKey, Map<String, Double>> finalTotals, double durationSeconds)
    implements EngineEvent {

  public WorkloadStoppedEvent {
    keys = keys == null ? List.of() : List.copyOf(keys);
    finalTotals = finalTotals == null ? Map.of() : Map.copyOf(finalTotals);
  }

  public WorkloadStoppedEvent(List<EntityKey> keys) {
    this(keys, Map.of(), 0);
  }

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitWorkloadStopped(this);
  }
}
