package com.mk.fx.qa.dbstress.experiment;

/** Live view of the runner. {@code variant} is null outside a run. */
public record ExperimentStatus(
    boolean running,
    ExperimentPhase phase,
    VariantId variant,
    int samplesA,
    int samplesB,
    long discardedSamples) {}
