package com.mk.fx.qa.dbstress.engine;

import com.mk.fx.qa.dbstress.catalog.EntityInfo;
import com.mk.fx.qa.dbstress.experiment.ExperimentConfig;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.SizeParams;
import com.mk.fx.qa.dbstress.model.WorkloadConfig;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Requests the dashboard sends to the remote execution engine. Outcomes of long-running work are
 * reported back through push events; the replies here only confirm acceptance.
 *
 * <p>Synchronous verbs throw {@link com.mk.fx.qa.dbstress.error.RemoteRequestFailedException};
 * asynchronous ones complete exceptionally with it.
 */
public interface EngineGateway {

  void startWorkload(Map<EntityKey, WorkloadConfig> configsByKey);

  void stopWorkload();

  void stopWorkload(EntityKey key);

  /** {@code revision} increases with every accepted update so the engine can drop stale ones. */
  CompletableFuture<Void> reconfigure(EntityKey key, WorkloadConfig config, long revision);

  CompletableFuture<Void> createEntity(EntityKey id, SizeParams sizeParams, Duration timeout);

  CompletableFuture<Void> dropEntity(EntityKey id, Duration timeout);

  /** Prefixes of every schema the engine currently holds. */
  List<EntityKey> listEntities();

  EntityInfo entityInfo(EntityKey id);

  void runExperiment(ExperimentConfig config);

  void stopExperiment();
}
