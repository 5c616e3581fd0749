package com.mk.fx.qa.dbstress.event;

import com.mk.fx.qa.dbstress.model.EntityKey;

/** Progress of a schema operation; {@code -1} reports failure, {@code 100} success. */
public record OperationProgressEvent(EntityKey id, String step, int percent)
    implements EngineEvent {

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitOperationProgress(this);
  }
}
