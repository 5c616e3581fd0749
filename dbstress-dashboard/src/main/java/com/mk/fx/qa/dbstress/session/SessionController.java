package com.mk.fx.qa.dbstress.session;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.dbstress.engine.EngineGateway;
import com.mk.fx.qa.dbstress.error.AlreadyRunningException;
import com.mk.fx.qa.dbstress.error.RemoteRequestFailedException;
import com.mk.fx.qa.dbstress.model.Channel;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.WorkloadConfig;
import com.mk.fx.qa.dbstress.telemetry.TelemetryNormalizer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Tracks which entities have a workload running and with which config.
 *
 * <p>Sessions are kept in start order; the first one is the primary session shown by the single
 * entity view. Stopping marks sessions inactive but keeps their series, so the charts keep the
 * last minute of history. Only {@link #start} activates a session; telemetry arriving after a stop
 * is still recorded by the normalizer but never reactivates anything.
 *
 * <p>State changes are short critical sections on this controller. Engine calls are made outside
 * the lock.
 */
@Slf4j
public class SessionController {

  private final TelemetryNormalizer normalizer;
  private final EngineGateway gateway;
  private final Clock clock;
  private final AtomicLong revisions = new AtomicLong();

  // guarded by this, insertion ordered
  private final Map<EntityKey, SessionState> sessions = new LinkedHashMap<>();

  public SessionController(TelemetryNormalizer normalizer, EngineGateway gateway, Clock clock) {
    this.normalizer = normalizer;
    this.gateway = gateway;
    this.clock = clock;
  }

  /**
   * Starts a workload for every key, in iteration order.
   *
   * @throws AlreadyRunningException if any key is already active; nothing is changed
   * @throws RemoteRequestFailedException if the engine refused; the keys are inactive again
   */
  public void start(Map<EntityKey, WorkloadConfig> configsByKey) {
    if (configsByKey.isEmpty()) {
      throw new IllegalArgumentException("At least one workload config is required");
    }
    var keys = List.copyOf(configsByKey.keySet());
    synchronized (this) {
      var running = keys.stream().filter(this::isActive).toList();
      if (!running.isEmpty()) {
        throw new AlreadyRunningException(running);
      }
      if (activeKeys().isEmpty()) {
        sessions.clear();
      }
      var now = clock.instant();
      configsByKey.forEach(
          (key, config) -> {
            sessions.remove(key);
            sessions.put(key, SessionState.started(key, config, revisions.incrementAndGet(), now));
            normalizer.resetScope(key);
          });
    }

    try {
      gateway.startWorkload(configsByKey);
    } catch (RemoteRequestFailedException ex) {
      synchronized (this) {
        var now = clock.instant();
        keys.forEach(key -> sessions.computeIfPresent(key, (k, s) -> s.stopped(now)));
      }
      log.warn("Engine refused to start workload for {}: {}", keys, ex.getMessage());
      throw ex;
    }
    log.info("Workload started for {}", keys);
  }

  /** Stops every session. Series are kept. */
  public void stop() {
    List<EntityKey> stopped;
    synchronized (this) {
      stopped = markStopped(sessions.keySet());
    }
    log.info("Stopping workload for {}", stopped);
    gateway.stopWorkload();
  }

  /** Stops one session; other sessions keep running. */
  public void stop(EntityKey key) {
    synchronized (this) {
      markStopped(List.of(key));
    }
    log.info("Stopping workload for {}", key);
    gateway.stopWorkload(key);
  }

  /** Engine reported that workers ended on its side. An empty collection means all of them. */
  public void onWorkloadStopped(Collection<EntityKey> keys) {
    List<EntityKey> stopped;
    synchronized (this) {
      stopped = markStopped(keys.isEmpty() ? sessions.keySet() : keys);
    }
    if (!stopped.isEmpty()) {
      log.info("Engine reported workload stopped for {}", stopped);
    }
  }

  /**
   * Replaces the config of an active session. Concurrent updates for a key resolve to the one
   * with the highest revision; the revision is forwarded so the engine can drop stale deliveries.
   *
   * @return false when the key has no active session
   */
  public boolean reconfigure(EntityKey key, WorkloadConfig config) {
    var revision = revisions.incrementAndGet();
    if (!applyRevision(key, config, revision)) {
      return false;
    }
    gateway
        .reconfigure(key, config, revision)
        .whenComplete(
            (ignored, failure) -> {
              if (failure != null) {
                log.warn(
                    "Engine did not accept config revision {} for {}: {}",
                    revision,
                    key,
                    failure.getMessage());
              }
            });
    return true;
  }

  @VisibleForTesting
  synchronized boolean applyRevision(EntityKey key, WorkloadConfig config, long revision) {
    var current = sessions.get(key);
    if (current == null || !current.active()) {
      log.warn("Config update for {} ignored, no active session", key);
      return false;
    }
    if (current.revision() > revision) {
      log.warn(
          "Stale config revision {} for {} ignored (current {})", revision, key, current.revision());
      return false;
    }
    sessions.put(key, current.withConfig(config, revision));
    log.info("Config for {} updated to revision {}", key, revision);
    return true;
  }

  public synchronized Optional<WorkloadConfig> config(EntityKey key) {
    return Optional.ofNullable(sessions.get(key)).map(SessionState::config);
  }

  public synchronized boolean isActive(EntityKey key) {
    var state = sessions.get(key);
    return state != null && state.active();
  }

  public synchronized List<EntityKey> activeKeys() {
    return sessions.values().stream().filter(SessionState::active).map(SessionState::key).toList();
  }

  /** The first-started session with its totals and series; empty before any start. */
  public Optional<PrimaryView> primaryView() {
    SessionState primary;
    synchronized (this) {
      primary = sessions.values().stream().findFirst().orElse(null);
    }
    if (primary == null) {
      return Optional.empty();
    }
    var key = primary.key();
    return Optional.of(
        new PrimaryView(
            key,
            primary.active(),
            primary.config(),
            primary.uptime(clock.instant()),
            normalizer.currentTotals(key),
            normalizer.snapshot(key, Channel.THROUGHPUT),
            normalizer.snapshot(key, Channel.OPERATIONS)));
  }

  public synchronized SessionStatus status() {
    var now = clock.instant();
    List<SessionInfo> infos = new ArrayList<>();
    for (var state : sessions.values()) {
      infos.add(
          new SessionInfo(
              state.key(),
              state.active(),
              state.config(),
              state.revision(),
              state.startedAt(),
              state.uptime(now).toSeconds()));
    }
    var active = activeKeys();
    long uptime =
        active.isEmpty() ? 0 : sessions.get(active.get(0)).uptime(now).toSeconds();
    return new SessionStatus(!active.isEmpty(), active, infos, uptime);
  }

  private List<EntityKey> markStopped(Collection<EntityKey> keys) {
    var now = clock.instant();
    List<EntityKey> stopped = new ArrayList<>();
    for (var key : List.copyOf(keys)) {
      var state = sessions.get(key);
      if (state != null && state.active()) {
        sessions.put(key, state.stopped(now));
        stopped.add(key);
      }
    }
    return stopped;
  }
}
