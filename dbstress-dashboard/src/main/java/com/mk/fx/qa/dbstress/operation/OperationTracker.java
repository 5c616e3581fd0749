package com.mk.fx.qa.dbstress.operation;

import com.mk.fx.qa.dbstress.error.DuplicateOperationException;
import com.mk.fx.qa.dbstress.model.EntityKey;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the operation table: one record per id, each with an independent progress state machine.
 *
 * <p>Thread-safety: records are created and replaced through {@link ConcurrentHashMap#compute},
 * which serialises begin calls per id; updates lock only the affected record. One operation's
 * progress never waits on another's.
 */
@Slf4j
public class OperationTracker {

  private final Clock clock;
  private final Map<EntityKey, OperationRecord> records = new ConcurrentHashMap<>();
  private final AtomicLong attempts = new AtomicLong();

  public OperationTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Starts tracking a new operation for {@code id}.
   *
   * @return the RUNNING record
   * @throws DuplicateOperationException if an unfinished operation exists for {@code id}
   */
  public OperationOutcome begin(EntityKey id, OperationKind kind) {
    var created =
        records.compute(
            id,
            (key, existing) -> {
              if (existing != null && !existing.isTerminal()) {
                throw new DuplicateOperationException(key);
              }
              var record = new OperationRecord(key, kind, attempts.incrementAndGet());
              record.markRunning(clock.instant(), "Starting " + kind.name().toLowerCase() + "...");
              return record;
            });
    log.info("Operation {} {} started (attempt {})", kind, id, created.attempt());
    return created.snapshot();
  }

  /**
   * Records a progress update. Updates for unknown or terminal operations are ignored.
   *
   * @return true when the update changed the record
   */
  public boolean observeProgress(EntityKey id, int percent, String step) {
    var record = records.get(id);
    if (record == null) {
      log.debug("Progress {}% for unknown operation {} ignored", percent, id);
      return false;
    }
    return applyProgress(record, percent, step);
  }

  /** Same as {@link #observeProgress} but only when {@code attempt} is still the current one. */
  public boolean observeProgress(EntityKey id, long attempt, int percent, String step) {
    var record = records.get(id);
    if (record == null || record.attempt() != attempt) {
      log.debug("Progress for superseded attempt {} of {} ignored", attempt, id);
      return false;
    }
    return applyProgress(record, percent, step);
  }

  /** Fails whatever attempt of {@code id} is current; no-op when it already finished. */
  public boolean fail(EntityKey id, FailureCause cause, String message) {
    var record = records.get(id);
    return record != null && fail(id, record.attempt(), cause, message);
  }

  /** Fails the current attempt of {@code id}; no-op when it already finished or was replaced. */
  public boolean fail(EntityKey id, long attempt, FailureCause cause, String message) {
    var record = records.get(id);
    if (record == null || record.attempt() != attempt) {
      return false;
    }
    var changed = record.markFailed(cause, message, clock.instant());
    if (changed) {
      log.warn("Operation {} failed ({}): {}", id, cause, message);
    }
    return changed;
  }

  public Optional<OperationOutcome> operationState(EntityKey id) {
    return Optional.ofNullable(records.get(id)).map(OperationRecord::snapshot);
  }

  public List<OperationOutcome> operations() {
    List<OperationOutcome> list = new ArrayList<>();
    for (var record : records.values()) {
      list.add(record.snapshot());
    }
    return list;
  }

  /**
   * Waits until every listed operation is terminal or {@code budget} elapses. Operations still
   * unfinished at the deadline are failed with {@link FailureCause#TIMEOUT}. One operation's
   * failure never prevents the others from being reported. Unknown ids are left out of the result.
   *
   * @return outcome per id, in the order given
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public Map<EntityKey, OperationOutcome> awaitAll(Collection<EntityKey> ids, Duration budget)
      throws InterruptedException {
    Map<EntityKey, OperationRecord> waiting = new LinkedHashMap<>();
    for (var id : ids) {
      var record = records.get(id);
      if (record == null) {
        log.warn("awaitAll: no operation recorded for {}", id);
        continue;
      }
      waiting.put(id, record);
    }

    var futures =
        waiting.values().stream()
            .map(OperationRecord::completion)
            .toArray(CompletableFuture[]::new);
    try {
      CompletableFuture.allOf(futures).get(budget.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException timeout) {
      for (var record : waiting.values()) {
        if (!record.isTerminal()) {
          fail(
              record.id(),
              record.attempt(),
              FailureCause.TIMEOUT,
              "No outcome within " + budget.toMillis() + "ms");
        }
      }
    } catch (ExecutionException unexpected) {
      // completions are only ever completed normally
      throw new IllegalStateException("Operation completion failed", unexpected.getCause());
    }

    Map<EntityKey, OperationOutcome> outcomes = new LinkedHashMap<>();
    waiting.forEach((id, record) -> outcomes.put(id, record.snapshot()));
    return outcomes;
  }

  CompletableFuture<OperationOutcome> completion(EntityKey id) {
    var record = records.get(id);
    if (record == null) {
      throw new IllegalArgumentException("No operation recorded for " + id);
    }
    return record.completion();
  }

  private boolean applyProgress(OperationRecord record, int percent, String step) {
    var changed = record.applyProgress(percent, step, clock.instant());
    if (!changed) {
      log.debug("Progress {}% for finished operation {} ignored", percent, record.id());
      return false;
    }
    var outcome = record.snapshot();
    if (outcome.isTerminal()) {
      log.info(
          "Operation {} {} finished {} ({})",
          outcome.kind(),
          outcome.id(),
          outcome.state(),
          outcome.step());
    }
    return true;
  }
}
