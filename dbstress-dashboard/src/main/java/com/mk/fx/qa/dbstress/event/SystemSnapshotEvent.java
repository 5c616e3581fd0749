package com.mk.fx.qa.dbstress.event;

import com.mk.fx.qa.dbstress.telemetry.SystemSnapshot;

public record SystemSnapshotEvent(SystemSnapshot snapshot) implements EngineEvent {

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitSystemSnapshot(this);
  }
}
