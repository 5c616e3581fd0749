package com.mk.fx.qa.dbstress.catalog;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.dbstress.engine.EngineGateway;
import com.mk.fx.qa.dbstress.model.EntityKey;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Latest view of the schemas held by the engine.
 *
 * <p>Refreshes run one at a time on a dedicated daemon thread, so callers reacting to push events
 * never block on the engine. A failed refresh keeps the previous snapshot.
 */
@Slf4j
public class SchemaCatalog implements AutoCloseable {

  private final EngineGateway gateway;
  private final Clock clock;
  private final ExecutorService executor;
  private final AtomicReference<CatalogSnapshot> latest = new AtomicReference<>();
  private final AtomicLong refreshes = new AtomicLong();
  private final AtomicLong failedRefreshes = new AtomicLong();

  public SchemaCatalog(EngineGateway gateway, Clock clock) {
    this(
        gateway,
        clock,
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r);
              t.setName("schema-catalog");
              t.setDaemon(true);
              return t;
            }));
  }

  @VisibleForTesting
  SchemaCatalog(EngineGateway gateway, Clock clock, ExecutorService executor) {
    this.gateway = gateway;
    this.clock = clock;
    this.executor = executor;
  }

  /**
   * Re-reads the schema list and fetches fresh details for {@code inspect}. Details of schemas no
   * longer listed are dropped.
   */
  public CompletableFuture<CatalogSnapshot> refresh(Collection<EntityKey> inspect) {
    var ids = Set.copyOf(inspect);
    try {
      return CompletableFuture.supplyAsync(() -> reload(ids), executor);
    } catch (RejectedExecutionException ex) {
      log.warn("Catalog refresh for {} skipped, catalog is closed", ids);
      return CompletableFuture.failedFuture(ex);
    }
  }

  /** The latest snapshot, loading the first one from the engine when none exists yet. */
  public CatalogSnapshot current() {
    var snapshot = latest.get();
    if (snapshot != null) {
      return snapshot;
    }
    try {
      return refresh(List.of()).join();
    } catch (CompletionException ex) {
      if (ex.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw ex;
    }
  }

  public Optional<CatalogSnapshot> latest() {
    return Optional.ofNullable(latest.get());
  }

  /** Fetches the details of one schema from the engine and keeps them in the latest snapshot. */
  public EntityInfo info(EntityKey id) {
    var info = gateway.entityInfo(id);
    latest.updateAndGet(
        current -> {
          if (current == null) {
            return null;
          }
          Map<EntityKey, EntityInfo> details = new LinkedHashMap<>(current.details());
          details.put(id, info);
          return new CatalogSnapshot(current.entities(), details, current.refreshedAt());
        });
    return info;
  }

  public long refreshCount() {
    return refreshes.get();
  }

  public long failedRefreshCount() {
    return failedRefreshes.get();
  }

  private CatalogSnapshot reload(Set<EntityKey> inspect) {
    List<EntityKey> listed;
    Map<EntityKey, EntityInfo> details = new LinkedHashMap<>();
    try {
      listed = gateway.listEntities();
      var previous = latest.get();
      for (var id : listed) {
        if (inspect.contains(id)) {
          details.put(id, gateway.entityInfo(id));
        } else if (previous != null && previous.details().containsKey(id)) {
          details.put(id, previous.details().get(id));
        }
      }
    } catch (RuntimeException ex) {
      failedRefreshes.incrementAndGet();
      log.warn("Catalog refresh failed, keeping previous snapshot: {}", ex.getMessage());
      throw ex;
    }
    var snapshot = new CatalogSnapshot(listed, details, clock.instant());
    latest.set(snapshot);
    refreshes.incrementAndGet();
    log.info("Catalog refreshed: {} schemas {}", listed.size(), listed);
    return snapshot;
  }

  @Override
  public void close() {
    executor.shutdownNow();
    try {
      executor.awaitTermination(2, TimeUnit.SECONDS);
    } catch (InterruptedException ignored) {
      Thread.currentThread().interrupt();
    }
  }
}
