package com.mk.fx.qa.dbstress.session;

import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.WorkloadConfig;
import java.time.Instant;

public record SessionInfo(
    EntityKey key,
    boolean active,
    WorkloadConfig config,
    long revision,
    Instant startedAt,
    long uptimeSeconds) {}
