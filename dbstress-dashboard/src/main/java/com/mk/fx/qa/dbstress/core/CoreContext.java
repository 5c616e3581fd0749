package com.mk.fx.qa.dbstress.core;

import com.mk.fx.qa.dbstress.catalog.SchemaCatalog;
import com.mk.fx.qa.dbstress.engine.EngineGateway;
import com.mk.fx.qa.dbstress.event.EngineEventDispatcher;
import com.mk.fx.qa.dbstress.event.EngineEventLoop;
import com.mk.fx.qa.dbstress.event.EngineEventParser;
import com.mk.fx.qa.dbstress.experiment.ExperimentResult;
import com.mk.fx.qa.dbstress.experiment.ExperimentRunner;
import com.mk.fx.qa.dbstress.experiment.PhaseTimer;
import com.mk.fx.qa.dbstress.model.Channel;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.Sample;
import com.mk.fx.qa.dbstress.operation.OperationOutcome;
import com.mk.fx.qa.dbstress.operation.OperationTracker;
import com.mk.fx.qa.dbstress.operation.ProvisioningService;
import com.mk.fx.qa.dbstress.series.BoundedSeriesStore;
import com.mk.fx.qa.dbstress.session.SessionController;
import com.mk.fx.qa.dbstress.telemetry.LenientNumberReader;
import com.mk.fx.qa.dbstress.telemetry.MalformedFieldTracker;
import com.mk.fx.qa.dbstress.telemetry.TelemetryNormalizer;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires the dashboard core once per application and owns its threads. Every component is reached
 * through this context; none of them is a static singleton.
 */
@Slf4j
@Getter
public class CoreContext implements AutoCloseable {

  private final Clock clock;
  private final BoundedSeriesStore store;
  private final MalformedFieldTracker malformedFields;
  private final TelemetryNormalizer normalizer;
  private final OperationTracker tracker;
  private final SchemaCatalog catalog;
  private final ProvisioningService provisioning;
  private final SessionController sessions;
  private final ExperimentRunner experiments;
  private final EngineEventParser eventParser;
  private final EngineEventLoop eventLoop;

  public CoreContext(
      EngineGateway gateway, CoreSettings settings, Clock clock, PhaseTimer phaseTimer) {
    this.clock = clock;
    this.store = new BoundedSeriesStore(settings.seriesCapacity());
    this.malformedFields = new MalformedFieldTracker();
    this.normalizer = new TelemetryNormalizer(store);
    this.tracker = new OperationTracker(clock);
    this.catalog = new SchemaCatalog(gateway, clock);
    this.provisioning =
        new ProvisioningService(tracker, gateway, settings.operationBudget(), catalog);
    this.sessions = new SessionController(normalizer, gateway, clock);
    this.experiments = new ExperimentRunner(gateway, phaseTimer, clock);
    this.eventParser = new EngineEventParser(new LenientNumberReader(malformedFields), clock);
    this.eventLoop =
        new EngineEventLoop(
            new EngineEventDispatcher(normalizer, tracker, sessions, experiments),
            settings.eventQueueCapacity());
    log.info(
        "Dashboard core ready: seriesCapacity={} eventQueueCapacity={} operationBudget={}",
        settings.seriesCapacity(),
        settings.eventQueueCapacity(),
        settings.operationBudget());
  }

  /** Series for a key and channel; the default key reads the primary telemetry entity. */
  public List<Sample> snapshot(EntityKey key, Channel channel) {
    return normalizer.snapshot(key, channel);
  }

  public Optional<OperationOutcome> operationState(EntityKey id) {
    return tracker.operationState(id);
  }

  public Optional<ExperimentResult> experimentResult() {
    return experiments.experimentResult();
  }

  @Override
  public void close() {
    log.info("Shutting down dashboard core");
    eventLoop.close();
    experiments.close();
    catalog.close();
  }
}
