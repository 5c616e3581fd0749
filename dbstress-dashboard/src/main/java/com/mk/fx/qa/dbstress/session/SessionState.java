package com.mk.fx.qa.dbstress.session;

import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.WorkloadConfig;
import java.time.Duration;
import java.time.Instant;

/** Immutable state of one entity's workload; every change produces a new instance. */
record SessionState(
    EntityKey key,
    WorkloadConfig config,
    long revision,
    Instant startedAt,
    Instant stoppedAt,
    boolean active) {

  static SessionState started(EntityKey key, WorkloadConfig config, long revision, Instant now) {
    return new SessionState(key, config, revision, now, null, true);
  }

  SessionState withConfig(WorkloadConfig newConfig, long newRevision) {
    return new SessionState(key, newConfig, newRevision, startedAt, stoppedAt, active);
  }

  SessionState stopped(Instant now) {
    return active ? new SessionState(key, config, revision, startedAt, now, false) : this;
  }

  Duration uptime(Instant now) {
    var end = active || stoppedAt == null ? now : stoppedAt;
    var uptime = Duration.between(startedAt, end);
    return uptime.isNegative() ? Duration.ZERO : uptime;
  }
}
