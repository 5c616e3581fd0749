package com.mk.fx.qa.dbstress.event;

import com.mk.fx.qa.dbstress.experiment.ExperimentRunner;
import com.mk.fx.qa.dbstress.operation.OperationTracker;
import com.mk.fx.qa.dbstress.session.SessionController;
import com.mk.fx.qa.dbstress.telemetry.TelemetryNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Applies each engine event to the component that owns its state. */
@Slf4j
@RequiredArgsConstructor
public class EngineEventDispatcher implements EngineEvent.Visitor<Void> {

  private final TelemetryNormalizer normalizer;
  private final OperationTracker tracker;
  private final SessionController sessions;
  private final ExperimentRunner runner;

  @Override
  public Void visitTelemetry(TelemetryEvent event) {
    normalizer.normalize(event.frame());
    return null;
  }

  @Override
  public Void visitOperationProgress(OperationProgressEvent event) {
    tracker.observeProgress(event.id(), event.percent(), event.step());
    return null;
  }

  @Override
  public Void visitSystemSnapshot(SystemSnapshotEvent event) {
    normalizer.acceptSystemSnapshot(event.snapshot());
    return null;
  }

  @Override
  public Void visitExperimentSample(ExperimentSampleEvent event) {
    runner.recordSample(event.variant(), event.toSample());
    return null;
  }

  @Override
  public Void visitWorkloadStopped(WorkloadStoppedEvent event) {
    event
        .finalTotals()
        .forEach(
            (key, totals) ->
                normalizer.recordTotals(key.isDefault() ? normalizer.primaryKey() : key, totals));
    if (!event.finalTotals().isEmpty()) {
      log.info(
          "Final totals after {}s: {}",
          String.format("%.1f", event.durationSeconds()),
          event.finalTotals());
    }
    sessions.onWorkloadStopped(event.keys());
    return null;
  }
}
