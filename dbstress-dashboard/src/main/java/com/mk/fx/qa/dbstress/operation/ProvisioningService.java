package com.mk.fx.qa.dbstress.operation;

import com.mk.fx.qa.dbstress.catalog.CatalogSnapshot;
import com.mk.fx.qa.dbstress.catalog.SchemaCatalog;
import com.mk.fx.qa.dbstress.engine.EngineGateway;
import com.mk.fx.qa.dbstress.engine.client.EngineCallException;
import com.mk.fx.qa.dbstress.error.DuplicateOperationException;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.SizeParams;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Issues schema create/drop requests and feeds their outcomes into the {@link OperationTracker}.
 *
 * <p>The engine answers a create request only once the schema is populated, while it also pushes
 * progress events for the same id. Whichever of the two arrives first decides the terminal state;
 * the later one is ignored by the tracker. Replies are matched to the attempt that sent them, so a
 * slow reply never touches a newer operation for the same id.
 *
 * <p>The {@link SchemaCatalog} is refreshed once an operation is terminal; for a batch, once after
 * every operation of the batch is terminal.
 */
@Slf4j
public class ProvisioningService {

  private static final Duration CATALOG_WAIT = Duration.ofSeconds(10);

  private final OperationTracker tracker;
  private final EngineGateway gateway;
  private final TimeoutBudget budget;
  private final SchemaCatalog catalog;

  public ProvisioningService(
      OperationTracker tracker, EngineGateway gateway, TimeoutBudget budget, SchemaCatalog catalog) {
    this.tracker = tracker;
    this.gateway = gateway;
    this.budget = budget;
    this.catalog = catalog;
  }

  /**
   * Outcome of a batch request: operations started, ids refused, and the longest budget. {@code
   * catalogRefreshed} completes once the catalog was re-read after the whole batch finished.
   */
  public record BatchSubmission(
      List<OperationOutcome> started,
      Map<EntityKey, String> rejected,
      Duration budget,
      CompletableFuture<CatalogSnapshot> catalogRefreshed) {

    public BatchSubmission {
      started = List.copyOf(started);
      rejected = Map.copyOf(rejected);
    }

    public BatchSubmission(
        List<OperationOutcome> started, Map<EntityKey, String> rejected, Duration budget) {
      this(started, rejected, budget, CompletableFuture.completedFuture(null));
    }

    public List<EntityKey> startedIds() {
      return started.stream().map(OperationOutcome::id).toList();
    }
  }

  /**
   * Starts provisioning {@code id}. Returns as soon as the request is sent.
   *
   * @throws DuplicateOperationException if an operation for {@code id} is still running
   */
  public OperationOutcome create(EntityKey id, SizeParams sizeParams) {
    var started = startCreate(id, sizeParams);
    refreshCatalogWhenDone(List.of(started.done()), List.of(id));
    return started.outcome();
  }

  /**
   * Starts one create per entry. Ids with an unfinished operation are reported in {@link
   * BatchSubmission#rejected()} and do not affect the others.
   */
  public BatchSubmission createAll(Map<EntityKey, SizeParams> requests) {
    List<OperationOutcome> started = new ArrayList<>();
    List<CompletableFuture<OperationOutcome>> done = new ArrayList<>();
    Map<EntityKey, String> rejected = new LinkedHashMap<>();
    var longest = Duration.ZERO;
    for (var entry : requests.entrySet()) {
      try {
        var attempt = startCreate(entry.getKey(), entry.getValue());
        started.add(attempt.outcome());
        done.add(attempt.done());
        var timeout = budget.forUnits(entry.getValue().unitCount());
        if (timeout.compareTo(longest) > 0) {
          longest = timeout;
        }
      } catch (DuplicateOperationException ex) {
        log.warn("Batch create skipped {}: {}", entry.getKey(), ex.getMessage());
        rejected.put(entry.getKey(), ex.getMessage());
      }
    }
    if (started.isEmpty()) {
      return new BatchSubmission(started, rejected, longest);
    }
    var ids = started.stream().map(OperationOutcome::id).toList();
    return new BatchSubmission(started, rejected, longest, refreshCatalogWhenDone(done, ids));
  }

  /**
   * Waits until every operation of the batch is terminal or its budget is spent, then for the
   * catalog refresh that follows. A refresh that fails or is slow is logged and does not change
   * the outcomes.
   */
  public Map<EntityKey, OperationOutcome> awaitBatch(BatchSubmission submission)
      throws InterruptedException {
    var outcomes = tracker.awaitAll(submission.startedIds(), submission.budget());
    try {
      submission.catalogRefreshed().get(CATALOG_WAIT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (ExecutionException | TimeoutException ex) {
      log.warn(
          "Batch {} finished but the catalog was not refreshed: {}",
          submission.startedIds(),
          unwrap(ex).toString());
    }
    return outcomes;
  }

  /**
   * Starts dropping {@code id}.
   *
   * @throws DuplicateOperationException if an operation for {@code id} is still running
   */
  public OperationOutcome drop(EntityKey id) {
    var timeout = budget.forUnits(1);
    var started = tracker.begin(id, OperationKind.DROP);
    var done = tracker.completion(id);
    log.info("Dropping schema {} (timeout={}ms)", id, timeout.toMillis());
    dispatch(started, timeout, () -> gateway.dropEntity(id, timeout));
    refreshCatalogWhenDone(List.of(done), List.of(id));
    return started;
  }

  public TimeoutBudget budget() {
    return budget;
  }

  private record Started(OperationOutcome outcome, CompletableFuture<OperationOutcome> done) {}

  private Started startCreate(EntityKey id, SizeParams sizeParams) {
    var timeout = budget.forUnits(sizeParams.unitCount());
    var started = tracker.begin(id, OperationKind.CREATE);
    var done = tracker.completion(id);
    log.info(
        "Creating schema {} (scaleFactor={}, parallelism={}, compress={}, timeout={}ms)",
        id,
        sizeParams.scaleFactor(),
        sizeParams.parallelism(),
        sizeParams.compress(),
        timeout.toMillis());
    dispatch(started, timeout, () -> gateway.createEntity(id, sizeParams, timeout));
    return new Started(started, done);
  }

  private CompletableFuture<CatalogSnapshot> refreshCatalogWhenDone(
      List<CompletableFuture<OperationOutcome>> done, List<EntityKey> ids) {
    return CompletableFuture.allOf(done.toArray(CompletableFuture[]::new))
        .thenCompose(ignored -> catalog.refresh(ids));
  }

  private void dispatch(
      OperationOutcome started, Duration timeout, Supplier<CompletableFuture<Void>> request) {
    CompletableFuture<Void> reply;
    try {
      reply = request.get();
    } catch (RuntimeException ex) {
      reply = CompletableFuture.failedFuture(ex);
    }
    reply
        .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .whenComplete((ignored, throwable) -> reconcile(started, timeout, throwable));
  }

  private void reconcile(OperationOutcome started, Duration timeout, Throwable throwable) {
    var id = started.id();
    var attempt = started.attempt();
    if (throwable == null) {
      var step =
          started.kind() == OperationKind.CREATE
              ? "Schema created successfully!"
              : "Schema dropped successfully!";
      tracker.observeProgress(id, attempt, OperationRecord.DONE_PROGRESS, step);
      return;
    }
    var cause = unwrap(throwable);
    if (isTimeout(cause)) {
      tracker.fail(
          id, attempt, FailureCause.TIMEOUT, "No reply within " + timeout.toMillis() + "ms");
    } else {
      tracker.fail(id, attempt, FailureCause.REMOTE_REQUEST_FAILED, cause.getMessage());
    }
  }

  private static boolean isTimeout(Throwable cause) {
    for (var t = cause; t != null; t = t.getCause()) {
      if (t instanceof TimeoutException) {
        return true;
      }
      if (t instanceof EngineCallException call && call.isTimedOut()) {
        return true;
      }
    }
    return false;
  }

  private static Throwable unwrap(Throwable throwable) {
    var t = throwable;
    while ((t instanceof CompletionException || t instanceof ExecutionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
