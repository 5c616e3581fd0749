package com.mk.fx.qa.dbstress.session;

import com.mk.fx.qa.dbstress.model.EntityKey;
import java.util.List;

/**
 * Point-in-time view of all sessions. {@code uptimeSeconds} is the primary session's uptime, zero
 * when nothing is running.
 */
public record SessionStatus(
    boolean running, List<EntityKey> activeKeys, List<SessionInfo> sessions, long uptimeSeconds) {

  public SessionStatus {
    activeKeys = List.copyOf(activeKeys);
    sessions = List.copyOf(sessions);
  }
}
