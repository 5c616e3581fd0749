package com.mk.fx.qa.dbstress.event;

/**
 * A push from the execution engine. Every event goes through the single {@link EngineEventLoop}
 * and reaches its handler through {@link Visitor}, so adding a variant breaks every handler that
 * does not cover it.
 */
public sealed interface EngineEvent
    permits TelemetryEvent,
        OperationProgressEvent,
        SystemSnapshotEvent,
        ExperimentSampleEvent,
        WorkloadStoppedEvent {

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitTelemetry(TelemetryEvent event);

    R visitOperationProgress(OperationProgressEvent event);

    R visitSystemSnapshot(SystemSnapshotEvent event);

    R visitExperimentSample(ExperimentSampleEvent event);

    R visitWorkloadStopped(WorkloadStoppedEvent event);
  }
}
