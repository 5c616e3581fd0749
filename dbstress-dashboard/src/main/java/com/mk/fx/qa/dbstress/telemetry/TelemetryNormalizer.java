package com.mk.fx.qa.dbstress.telemetry;

import com.mk.fx.qa.dbstress.model.Channel;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.Sample;
import com.mk.fx.qa.dbstress.series.BoundedSeriesStore;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns decoded telemetry frames into per-entity series updates.
 *
 * <p>Every entity of a frame gets one {@link Channel#THROUGHPUT} and one {@link
 * Channel#OPERATIONS} sample plus its latest totals. The first entity of the most recent frame is
 * the primary entity: reads addressed to {@link EntityKey#DEFAULT} resolve to it, so consumers
 * that only know the single-entity view keep working in multi-entity mode. Nothing is copied on
 * write, so the default view cannot drift from the entity it mirrors.
 *
 * <p>The system snapshot is not windowed; each new one replaces the previous.
 */
@Slf4j
public class TelemetryNormalizer {

  private final BoundedSeriesStore store;
  private final Map<EntityKey, Map<String, Double>> currentTotals = new ConcurrentHashMap<>();
  private final AtomicReference<EntityKey> primaryKey = new AtomicReference<>(EntityKey.DEFAULT);
  private final AtomicReference<SystemSnapshot> systemSnapshot = new AtomicReference<>();
  private final AtomicLong framesApplied = new AtomicLong();

  public TelemetryNormalizer(BoundedSeriesStore store) {
    this.store = store;
  }

  /** Applies a frame. Frames without entities leave every series untouched. */
  public void normalize(TelemetryFrame frame) {
    if (frame.isEmpty()) {
      log.debug("Telemetry frame at {} carries no entities, nothing applied", frame.timestamp());
      return;
    }

    EntityKey first = null;
    for (var entry : frame.entities().entrySet()) {
      var key = entry.getKey();
      var telemetry = entry.getValue();
      store.append(key, Channel.THROUGHPUT, throughputSample(frame, telemetry));
      store.append(key, Channel.OPERATIONS, operationsSample(frame, telemetry));
      currentTotals.put(key, telemetry.totals());
      if (first == null) {
        first = key;
      }
    }

    var previous = primaryKey.getAndSet(first);
    if (!previous.equals(first)) {
      log.info("Primary telemetry entity changed from {} to {}", previous, first);
    }
    framesApplied.incrementAndGet();
  }

  /**
   * Starts a fresh logical run for {@code key}: its series windows are replaced and the totals of
   * the previous run are forgotten.
   */
  public void resetScope(EntityKey key) {
    store.replaceScope(key);
    currentTotals.remove(key);
    log.debug("Telemetry scope reset for {}", key);
  }

  /** Records totals reported outside a telemetry frame, e.g. the final figures of a stopped run. */
  public void recordTotals(EntityKey key, Map<String, Double> totals) {
    if (totals.isEmpty()) {
      return;
    }
    currentTotals.merge(
        key,
        Map.copyOf(totals),
        (previous, latest) -> {
          Map<String, Double> merged = new HashMap<>(previous);
          merged.putAll(latest);
          return Map.copyOf(merged);
        });
  }

  /** Series for a key; {@link EntityKey#DEFAULT} resolves to the primary entity. */
  public List<Sample> snapshot(EntityKey key, Channel channel) {
    return store.snapshot(resolve(key), channel);
  }

  /** Latest totals for a key; {@link EntityKey#DEFAULT} resolves to the primary entity. */
  public Map<String, Double> currentTotals(EntityKey key) {
    return currentTotals.getOrDefault(resolve(key), Map.of());
  }

  public EntityKey primaryKey() {
    return primaryKey.get();
  }

  public void acceptSystemSnapshot(SystemSnapshot snapshot) {
    systemSnapshot.set(snapshot);
  }

  public Optional<SystemSnapshot> latestSystemSnapshot() {
    return Optional.ofNullable(systemSnapshot.get());
  }

  public long framesApplied() {
    return framesApplied.get();
  }

  private EntityKey resolve(EntityKey key) {
    return key.isDefault() ? primaryKey.get() : key;
  }

  private static Sample throughputSample(TelemetryFrame frame, EntityTelemetry telemetry) {
    return new Sample(frame.timestamp(), Map.of("tps", telemetry.throughput()));
  }

  private static Sample operationsSample(TelemetryFrame frame, EntityTelemetry telemetry) {
    return new Sample(
        frame.timestamp(),
        Map.of(
            "inserts", telemetry.inserts(),
            "updates", telemetry.updates(),
            "deletes", telemetry.deletes(),
            "selects", telemetry.selects()));
  }
}
