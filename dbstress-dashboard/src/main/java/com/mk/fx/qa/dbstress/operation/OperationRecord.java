package com.mk.fx.qa.dbstress.operation;

import com.mk.fx.qa.dbstress.model.EntityKey;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable state of one long-running remote operation.
 *
 * <p>Lifecycle: PENDING → RUNNING → SUCCEEDED (progress 100) or FAILED (progress -1). Once
 * terminal the record never changes again and {@link #completion()} is completed with the final
 * outcome. All mutators are synchronized on the record.
 */
final class OperationRecord {

  static final int FAILED_PROGRESS = -1;
  static final int DONE_PROGRESS = 100;

  private final EntityKey id;
  private final OperationKind kind;
  private final long attempt;
  private final CompletableFuture<OperationOutcome> completion = new CompletableFuture<>();

  private OperationState state = OperationState.PENDING;
  private int progressPercent;
  private String step = "Pending";
  private Instant startedAt;
  private Instant finishedAt;
  private FailureCause failureCause;
  private String message;

  OperationRecord(EntityKey id, OperationKind kind, long attempt) {
    this.id = id;
    this.kind = kind;
    this.attempt = attempt;
  }

  synchronized void markRunning(Instant now, String initialStep) {
    if (state != OperationState.PENDING) {
      return;
    }
    state = OperationState.RUNNING;
    startedAt = now;
    step = initialStep;
  }

  /**
   * Applies a progress update.
   *
   * @return false when the record is terminal and the update was ignored
   */
  synchronized boolean applyProgress(int percent, String newStep, Instant now) {
    if (state.isTerminal()) {
      return false;
    }
    if (newStep != null && !newStep.isBlank()) {
      step = newStep;
    }
    if (percent == FAILED_PROGRESS) {
      finish(OperationState.FAILED, FAILED_PROGRESS, FailureCause.ENGINE_REPORTED, step, now);
    } else if (percent >= DONE_PROGRESS) {
      finish(OperationState.SUCCEEDED, DONE_PROGRESS, null, null, now);
    } else {
      state = OperationState.RUNNING;
      progressPercent = Math.max(0, percent);
    }
    return true;
  }

  synchronized boolean markFailed(FailureCause cause, String failureMessage, Instant now) {
    if (state.isTerminal()) {
      return false;
    }
    finish(OperationState.FAILED, FAILED_PROGRESS, cause, failureMessage, now);
    return true;
  }

  private void finish(
      OperationState terminal, int progress, FailureCause cause, String failureMessage, Instant now) {
    state = terminal;
    progressPercent = progress;
    failureCause = cause;
    message = failureMessage;
    finishedAt = now;
    if (startedAt == null) {
      startedAt = now;
    }
    completion.complete(snapshot());
  }

  synchronized OperationOutcome snapshot() {
    return new OperationOutcome(
        id,
        kind,
        state,
        progressPercent,
        step,
        attempt,
        startedAt,
        finishedAt,
        failureCause,
        message);
  }

  synchronized boolean isTerminal() {
    return state.isTerminal();
  }

  long attempt() {
    return attempt;
  }

  EntityKey id() {
    return id;
  }

  CompletableFuture<OperationOutcome> completion() {
    return completion;
  }
}
