package com.mk.fx.qa.dbstress.operation;

import com.mk.fx.qa.dbstress.model.EntityKey;
import java.time.Instant;

/**
 * Point-in-time view of an operation record. {@code attempt} distinguishes successive operations
 * that reused the same id.
 */
public record OperationOutcome(
    EntityKey id,
    OperationKind kind,
    OperationState state,
    int progressPercent,
    String step,
    long attempt,
    Instant startedAt,
    Instant finishedAt,
    FailureCause failureCause,
    String message) {

  public boolean succeeded() {
    return state == OperationState.SUCCEEDED;
  }

  public boolean isTerminal() {
    return state.isTerminal();
  }
}
