package com.mk.fx.qa.dbstress.event;

import com.mk.fx.qa.dbstress.telemetry.TelemetryFrame;

public record TelemetryEvent(TelemetryFrame frame) implements EngineEvent {

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitTelemetry(this);
  }
}
