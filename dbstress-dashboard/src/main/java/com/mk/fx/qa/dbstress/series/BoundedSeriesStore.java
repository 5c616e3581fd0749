package com.mk.fx.qa.dbstress.series;

import com.mk.fx.qa.dbstress.model.Channel;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.Sample;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-capacity time series per (entity, channel).
 *
 * <p>Each entity owns one window holding a series per channel. Appends for different entities run
 * in parallel; appends and snapshots for the same entity are serialised on that entity's window,
 * so one key's order is never interleaved. Samples only leave a series through capacity eviction.
 * {@link #replaceScope(EntityKey)} swaps an entity's whole window for a fresh one when a new
 * logical run starts.
 */
@Slf4j
public class BoundedSeriesStore {

  public static final int DEFAULT_CAPACITY = 60;

  @Getter private final int capacity;
  private final Map<EntityKey, EntityWindow> windows = new ConcurrentHashMap<>();

  public BoundedSeriesStore() {
    this(DEFAULT_CAPACITY);
  }

  public BoundedSeriesStore(int capacity) {
    if (capacity <= 0) throw new IllegalArgumentException("Capacity must be > 0");
    this.capacity = capacity;
  }

  /** Appends a sample, evicting the oldest one when the series is full. */
  public void append(EntityKey key, Channel channel, Sample sample) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(sample, "sample");
    windows.computeIfAbsent(key, k -> new EntityWindow(capacity)).append(channel, sample);
  }

  /** Returns the current window in insertion order; empty when nothing was recorded. */
  public List<Sample> snapshot(EntityKey key, Channel channel) {
    var window = windows.get(key);
    return window == null ? List.of() : window.snapshot(channel);
  }

  /** Returns the entities that have at least one sample on the channel. */
  public Set<EntityKey> keys(Channel channel) {
    Set<EntityKey> keys = new LinkedHashSet<>();
    windows.forEach(
        (key, window) -> {
          if (window.hasSamples(channel)) {
            keys.add(key);
          }
        });
    return Set.copyOf(keys);
  }

  /** Replaces the entity's window with an empty one. In-flight appends land in either window. */
  public void replaceScope(EntityKey key) {
    windows.put(key, new EntityWindow(capacity));
    log.debug("Series window replaced for {}", key);
  }

  private static final class EntityWindow {
    private final int capacity;
    private final Map<Channel, Series> series = new EnumMap<>(Channel.class);

    private EntityWindow(int capacity) {
      this.capacity = capacity;
    }

    synchronized void append(Channel channel, Sample sample) {
      series.computeIfAbsent(channel, c -> new Series(capacity)).append(sample);
    }

    synchronized List<Sample> snapshot(Channel channel) {
      var s = series.get(channel);
      return s == null ? List.of() : s.toList();
    }

    synchronized boolean hasSamples(Channel channel) {
      var s = series.get(channel);
      return s != null && !s.isEmpty();
    }
  }
}
