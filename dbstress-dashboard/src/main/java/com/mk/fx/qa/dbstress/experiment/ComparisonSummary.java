package com.mk.fx.qa.dbstress.experiment;

/**
 * Differences are B minus A. {@code throughputDeltaPercent} is relative to A and null when A's
 * mean is zero. {@code efficiencyWinner} is null unless both variants reported efficiency.
 */
public record ComparisonSummary(
    double throughputDelta,
    Double throughputDeltaPercent,
    double responseTimeDelta,
    Winner throughputWinner,
    Winner responseTimeWinner,
    Winner efficiencyWinner) {}
