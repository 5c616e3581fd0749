package com.mk.fx.qa.dbstress.operation;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.dbstress.MutableClock;
import com.mk.fx.qa.dbstress.error.DuplicateOperationException;
import com.mk.fx.qa.dbstress.model.EntityKey;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OperationTrackerTest {

  private static final EntityKey A = EntityKey.of("A");
  private static final EntityKey B = EntityKey.of("B");
  private static final EntityKey C = EntityKey.of("C");

  private MutableClock clock;
  private OperationTracker tracker;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    tracker = new OperationTracker(clock);
  }

  @Test
  void begin_returnsRunningRecord() {
    var outcome = tracker.begin(A, OperationKind.CREATE);

    assertEquals(OperationState.RUNNING, outcome.state());
    assertEquals(0, outcome.progressPercent());
    assertEquals(clock.instant(), outcome.startedAt());
    assertNull(outcome.finishedAt());
  }

  @Test
  void begin_whileUnfinished_throwsDuplicate() {
    tracker.begin(A, OperationKind.CREATE);

    assertThrows(DuplicateOperationException.class, () -> tracker.begin(A, OperationKind.DROP));
    assertEquals(OperationKind.CREATE, tracker.operationState(A).orElseThrow().kind());
  }

  @Test
  void begin_afterTerminal_reusesIdWithNewAttempt() {
    var first = tracker.begin(A, OperationKind.CREATE);
    tracker.observeProgress(A, 100, "done");

    var second = tracker.begin(A, OperationKind.DROP);

    assertNotEquals(first.attempt(), second.attempt());
    assertEquals(OperationState.RUNNING, tracker.operationState(A).orElseThrow().state());
  }

  @Test
  void progress_hundredThenFifty_staysSucceeded() {
    tracker.begin(A, OperationKind.CREATE);
    clock.advance(Duration.ofSeconds(3));

    assertTrue(tracker.observeProgress(A, 100, "Schema created successfully!"));
    assertFalse(tracker.observeProgress(A, 50, "Populating data..."));

    var outcome = tracker.operationState(A).orElseThrow();
    assertEquals(OperationState.SUCCEEDED, outcome.state());
    assertEquals(100, outcome.progressPercent());
    assertEquals("Schema created successfully!", outcome.step());
    assertEquals(clock.instant(), outcome.finishedAt());
  }

  @Test
  void progress_minusOne_failsWithEngineMessage() {
    tracker.begin(A, OperationKind.CREATE);
    tracker.observeProgress(A, 20, "Creating tables...");

    tracker.observeProgress(A, -1, "Error: ORA-01031 insufficient privileges");

    var outcome = tracker.operationState(A).orElseThrow();
    assertEquals(OperationState.FAILED, outcome.state());
    assertEquals(-1, outcome.progressPercent());
    assertEquals(FailureCause.ENGINE_REPORTED, outcome.failureCause());
    assertEquals("Error: ORA-01031 insufficient privileges", outcome.message());
  }

  @Test
  void progress_outOfRange_isClamped() {
    tracker.begin(A, OperationKind.CREATE);
    tracker.observeProgress(A, -5, "odd");
    assertEquals(0, tracker.operationState(A).orElseThrow().progressPercent());

    tracker.observeProgress(A, 140, "over");
    var outcome = tracker.operationState(A).orElseThrow();
    assertEquals(OperationState.SUCCEEDED, outcome.state());
    assertEquals(100, outcome.progressPercent());
  }

  @Test
  void progress_unknownId_isIgnored() {
    assertFalse(tracker.observeProgress(A, 50, "x"));
    assertTrue(tracker.operationState(A).isEmpty());
  }

  @Test
  void fail_forSupersededAttempt_isIgnored() {
    var first = tracker.begin(A, OperationKind.CREATE);
    tracker.observeProgress(A, 100, "done");
    tracker.begin(A, OperationKind.CREATE);

    assertFalse(tracker.fail(A, first.attempt(), FailureCause.TIMEOUT, "late"));
    assertEquals(OperationState.RUNNING, tracker.operationState(A).orElseThrow().state());
  }

  @Test
  void fail_withoutAttempt_failsCurrentOperation() {
    tracker.begin(A, OperationKind.DROP);

    assertTrue(tracker.fail(A, FailureCause.REMOTE_REQUEST_FAILED, "refused"));
    assertFalse(tracker.fail(A, FailureCause.TIMEOUT, "again"));
    assertEquals(
        FailureCause.REMOTE_REQUEST_FAILED, tracker.operationState(A).orElseThrow().failureCause());
  }

  @Test
  void awaitAll_partialFailure_reportsEveryIdIndependently() throws Exception {
    tracker.begin(A, OperationKind.CREATE);
    tracker.begin(B, OperationKind.CREATE);
    tracker.begin(C, OperationKind.CREATE);
    tracker.observeProgress(A, 100, "ok");
    tracker.observeProgress(B, -1, "boom");

    var outcomes = tracker.awaitAll(List.of(A, B, C), Duration.ofMillis(150));

    assertEquals(List.of(A, B, C), List.copyOf(outcomes.keySet()));
    assertEquals(OperationState.SUCCEEDED, outcomes.get(A).state());
    assertEquals(FailureCause.ENGINE_REPORTED, outcomes.get(B).failureCause());
    assertEquals(OperationState.FAILED, outcomes.get(C).state());
    assertEquals(FailureCause.TIMEOUT, outcomes.get(C).failureCause());
  }

  @Test
  void awaitAll_returnsAsSoonAsAllAreTerminal() throws Exception {
    tracker.begin(A, OperationKind.CREATE);
    tracker.begin(B, OperationKind.CREATE);
    CompletableFuture.runAsync(
        () -> {
          tracker.observeProgress(A, 100, "ok");
          tracker.observeProgress(B, 100, "ok");
        },
        CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));

    long start = System.nanoTime();
    var outcomes = tracker.awaitAll(List.of(A, B), Duration.ofSeconds(10));
    long elapsedMs = (System.nanoTime() - start) / 1_000_000;

    assertTrue(elapsedMs < 5_000, "awaitAll waited " + elapsedMs + "ms");
    assertTrue(outcomes.values().stream().allMatch(OperationOutcome::succeeded));
  }

  @Test
  void awaitAll_leavesOutUnknownIds() throws Exception {
    tracker.begin(A, OperationKind.CREATE);
    tracker.observeProgress(A, 100, "ok");

    var outcomes = tracker.awaitAll(List.of(A, B), Duration.ofMillis(50));

    assertEquals(List.of(A), List.copyOf(outcomes.keySet()));
  }

  @Test
  void completion_completesWithTerminalOutcome() throws Exception {
    tracker.begin(A, OperationKind.CREATE);
    var completion = tracker.completion(A);
    assertFalse(completion.isDone());

    tracker.observeProgress(A, 100, "ok");

    assertEquals(OperationState.SUCCEEDED, completion.get(1, TimeUnit.SECONDS).state());
  }

  @Test
  void operations_listsAllRecords() {
    tracker.begin(A, OperationKind.CREATE);
    tracker.begin(B, OperationKind.DROP);

    assertEquals(2, tracker.operations().size());
  }
}
