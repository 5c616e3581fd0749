package com.mk.fx.qa.dbstress.operation;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.dbstress.MutableClock;
import com.mk.fx.qa.dbstress.catalog.CatalogSnapshot;
import com.mk.fx.qa.dbstress.catalog.SchemaCatalog;
import com.mk.fx.qa.dbstress.engine.EngineGateway;
import com.mk.fx.qa.dbstress.error.RemoteRequestFailedException;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.SizeParams;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProvisioningServiceTest {

  private static final EntityKey A = EntityKey.of("A");
  private static final EntityKey B = EntityKey.of("B");
  private static final SizeParams SIZE = new SizeParams(2, 4, false);
  private static final CatalogSnapshot CATALOG =
      new CatalogSnapshot(List.of(A), Map.of(), Instant.parse("2024-05-01T10:00:00Z"));

  @Mock EngineGateway gateway;
  @Mock SchemaCatalog catalog;

  private OperationTracker tracker;
  private ProvisioningService service;

  @BeforeEach
  void setUp() {
    tracker = new OperationTracker(new MutableClock(Instant.parse("2024-05-01T10:00:00Z")));
    service =
        new ProvisioningService(
            tracker, gateway, TimeoutBudget.ofMillis(1_000, 500, 10_000), catalog);
    lenient().when(catalog.refresh(any())).thenReturn(CompletableFuture.completedFuture(CATALOG));
  }

  private OperationOutcome state(EntityKey id) {
    return tracker.operationState(id).orElseThrow();
  }

  @Test
  void create_sendsSizeDependentTimeout() {
    when(gateway.createEntity(any(), any(), any())).thenReturn(new CompletableFuture<>());

    var started = service.create(A, SIZE);

    assertEquals(OperationState.RUNNING, started.state());
    assertEquals(OperationKind.CREATE, started.kind());
    verify(gateway).createEntity(A, SIZE, Duration.ofMillis(3_000));
  }

  @Test
  void create_successReply_marksSucceeded() {
    when(gateway.createEntity(any(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));

    service.create(A, SIZE);

    assertEquals(OperationState.SUCCEEDED, state(A).state());
    assertEquals(100, state(A).progressPercent());
  }

  @Test
  void pushEventBeforeReply_pushEventDecides() {
    var reply = new CompletableFuture<Void>();
    when(gateway.createEntity(any(), any(), any())).thenReturn(reply);
    service.create(A, SIZE);

    tracker.observeProgress(A, 100, "Schema created successfully!");
    var finishedAt = state(A).finishedAt();
    reply.complete(null);

    assertEquals(OperationState.SUCCEEDED, state(A).state());
    assertEquals(finishedAt, state(A).finishedAt());
  }

  @Test
  void failurePushBeforeSuccessReply_staysFailed() {
    var reply = new CompletableFuture<Void>();
    when(gateway.createEntity(any(), any(), any())).thenReturn(reply);
    service.create(A, SIZE);

    tracker.observeProgress(A, -1, "Error: tablespace full");
    reply.complete(null);

    assertEquals(OperationState.FAILED, state(A).state());
    assertEquals(FailureCause.ENGINE_REPORTED, state(A).failureCause());
  }

  @Test
  void replyBeforePushEvent_lateEventIgnored() {
    when(gateway.createEntity(any(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));
    service.create(A, SIZE);

    tracker.observeProgress(A, -1, "Error: late");
    tracker.observeProgress(A, 40, "Populating data...");

    assertEquals(OperationState.SUCCEEDED, state(A).state());
  }

  @Test
  void failedReply_marksRemoteRequestFailedWithEngineMessage() {
    when(gateway.createEntity(any(), any(), any()))
        .thenReturn(
            CompletableFuture.failedFuture(
                new RemoteRequestFailedException("ORA-01031: insufficient privileges", 500)));

    service.create(A, SIZE);

    assertEquals(OperationState.FAILED, state(A).state());
    assertEquals(FailureCause.REMOTE_REQUEST_FAILED, state(A).failureCause());
    assertEquals("ORA-01031: insufficient privileges", state(A).message());
  }

  @Test
  void gatewayThrowingSynchronously_marksRemoteRequestFailed() {
    when(gateway.dropEntity(any(), any()))
        .thenThrow(new RemoteRequestFailedException("connection refused", 0));

    service.drop(A);

    assertEquals(OperationKind.DROP, state(A).kind());
    assertEquals(FailureCause.REMOTE_REQUEST_FAILED, state(A).failureCause());
  }

  @Test
  void noReplyWithinBudget_marksTimeout() throws Exception {
    service = new ProvisioningService(tracker, gateway, TimeoutBudget.ofMillis(50, 0, 50), catalog);
    when(gateway.createEntity(any(), any(), any())).thenReturn(new CompletableFuture<>());
    service.create(A, SIZE);

    var outcome = tracker.awaitAll(List.of(A), Duration.ofSeconds(5)).get(A);

    assertEquals(OperationState.FAILED, outcome.state());
    assertEquals(FailureCause.TIMEOUT, outcome.failureCause());
  }

  @Test
  void lateReplyOfEarlierAttempt_doesNotTouchNewAttempt() {
    var firstReply = new CompletableFuture<Void>();
    var secondReply = new CompletableFuture<Void>();
    when(gateway.createEntity(any(), any(), any())).thenReturn(firstReply, secondReply);

    service.create(A, SIZE);
    tracker.observeProgress(A, -1, "Error: first attempt");
    var second = service.create(A, SIZE);
    firstReply.complete(null);

    assertEquals(second.attempt(), state(A).attempt());
    assertEquals(OperationState.RUNNING, state(A).state());
  }

  @Test
  void createAll_duplicateIsRejected_othersStart() {
    when(gateway.createEntity(any(), any(), any())).thenReturn(new CompletableFuture<>());
    tracker.begin(A, OperationKind.DROP);
    Map<EntityKey, SizeParams> batch = new LinkedHashMap<>();
    batch.put(A, SIZE);
    batch.put(B, new SizeParams(1, 10, true));

    var submission = service.createAll(batch);

    assertEquals(List.of(B), submission.startedIds());
    assertTrue(submission.rejected().containsKey(A));
    assertEquals(Duration.ofMillis(6_000), submission.budget());
    verify(gateway).createEntity(eq(B), any(), any());
  }

  @Test
  void awaitBatch_reportsMixedOutcomes() throws Exception {
    when(gateway.createEntity(eq(A), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));
    when(gateway.createEntity(eq(B), any(), any()))
        .thenReturn(
            CompletableFuture.failedFuture(new RemoteRequestFailedException("disk full", 500)));
    Map<EntityKey, SizeParams> batch = new LinkedHashMap<>();
    batch.put(A, SIZE);
    batch.put(B, SIZE);

    var outcomes = service.awaitBatch(service.createAll(batch));

    assertTrue(outcomes.get(A).succeeded());
    assertEquals(FailureCause.REMOTE_REQUEST_FAILED, outcomes.get(B).failureCause());
  }

  @Test
  void create_refreshesCatalogOnceTerminal() {
    var reply = new CompletableFuture<Void>();
    when(gateway.createEntity(any(), any(), any())).thenReturn(reply);

    service.create(A, SIZE);
    verify(catalog, never()).refresh(any());

    reply.complete(null);
    verify(catalog).refresh(List.of(A));
  }

  @Test
  void drop_refreshesCatalogAfterFailureToo() {
    when(gateway.dropEntity(any(), any()))
        .thenReturn(
            CompletableFuture.failedFuture(new RemoteRequestFailedException("ORA-00942", 500)));

    service.drop(A);

    verify(catalog).refresh(List.of(A));
  }

  @Test
  void awaitBatch_refreshesCatalogOnceAfterWholeBatch() throws Exception {
    var replyA = new CompletableFuture<Void>();
    var replyB = new CompletableFuture<Void>();
    when(gateway.createEntity(eq(A), any(), any())).thenReturn(replyA);
    when(gateway.createEntity(eq(B), any(), any())).thenReturn(replyB);
    Map<EntityKey, SizeParams> batch = new LinkedHashMap<>();
    batch.put(A, SIZE);
    batch.put(B, SIZE);

    var submission = service.createAll(batch);
    replyA.complete(null);
    verify(catalog, never()).refresh(any());

    replyB.complete(null);
    var outcomes = service.awaitBatch(submission);

    assertTrue(outcomes.get(A).succeeded());
    assertTrue(outcomes.get(B).succeeded());
    assertTrue(submission.catalogRefreshed().isDone());
    assertEquals(CATALOG, submission.catalogRefreshed().get());
    verify(catalog, times(1)).refresh(any());
    verify(catalog).refresh(List.of(A, B));
  }

  @Test
  void awaitBatch_catalogFailure_stillReturnsOutcomes() throws Exception {
    when(catalog.refresh(any()))
        .thenReturn(
            CompletableFuture.failedFuture(new RemoteRequestFailedException("list failed", 500)));
    when(gateway.createEntity(any(), any(), any()))
        .thenReturn(CompletableFuture.completedFuture(null));

    var outcomes = service.awaitBatch(service.createAll(Map.of(A, SIZE)));

    assertTrue(outcomes.get(A).succeeded());
    assertTrue(service.createAll(Map.of()).catalogRefreshed().isDone());
    verify(catalog, times(1)).refresh(any());
  }
}
