package com.mk.fx.qa.dbstress.experiment;

import java.time.Instant;

public record ExperimentResult(
    ExperimentConfig config,
    VariantResult variantA,
    VariantResult variantB,
    ComparisonSummary comparison,
    ExperimentPhase status,
    Instant startedAt,
    Instant finishedAt) {}
