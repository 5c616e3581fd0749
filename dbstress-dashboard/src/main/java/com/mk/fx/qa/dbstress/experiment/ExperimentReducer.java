package com.mk.fx.qa.dbstress.experiment;

import com.mk.fx.qa.dbstress.model.Sample;
import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;

/** Reduces measurement samples into means and per-metric winners. */
public final class ExperimentReducer {

  public static final String THROUGHPUT = "throughput";
  public static final String RESPONSE_TIME = "responseTimeMs";
  public static final String EFFICIENCY = "efficiency";

  private static final double TIE_TOLERANCE = 1e-9;

  private ExperimentReducer() {
    throw new UnsupportedOperationException("ExperimentReducer cannot be instantiated");
  }

  public static ExperimentResult reduce(
      ExperimentConfig config,
      List<Sample> samplesA,
      List<Sample> samplesB,
      ExperimentPhase status,
      Instant startedAt,
      Instant finishedAt) {
    var a = reduceVariant(config.variantA().label(), samplesA);
    var b = reduceVariant(config.variantB().label(), samplesB);
    return new ExperimentResult(config, a, b, compare(a, b), status, startedAt, finishedAt);
  }

  static VariantResult reduceVariant(String label, List<Sample> samples) {
    var withEfficiency = samples.stream().filter(s -> s.fields().containsKey(EFFICIENCY)).toList();
    var efficiency = mean(withEfficiency, EFFICIENCY);
    return new VariantResult(
        label,
        samples,
        mean(samples, THROUGHPUT).orElse(0.0),
        mean(samples, RESPONSE_TIME).orElse(0.0),
        efficiency.isPresent() ? efficiency.getAsDouble() : null);
  }

  static ComparisonSummary compare(VariantResult a, VariantResult b) {
    double throughputDelta = b.meanThroughput() - a.meanThroughput();
    Double throughputDeltaPercent =
        a.meanThroughput() == 0.0 ? null : throughputDelta / a.meanThroughput() * 100.0;
    Winner efficiencyWinner =
        a.meanEfficiency() != null && b.meanEfficiency() != null
            ? winner(a.meanEfficiency(), b.meanEfficiency(), true)
            : null;
    return new ComparisonSummary(
        throughputDelta,
        throughputDeltaPercent,
        b.meanResponseTime() - a.meanResponseTime(),
        winner(a.meanThroughput(), b.meanThroughput(), true),
        winner(a.meanResponseTime(), b.meanResponseTime(), false),
        efficiencyWinner);
  }

  static Winner winner(double a, double b, boolean higherIsBetter) {
    if (Math.abs(a - b) <= TIE_TOLERANCE) {
      return Winner.TIE;
    }
    boolean aBetter = higherIsBetter ? a > b : a < b;
    return aBetter ? Winner.A : Winner.B;
  }

  private static OptionalDouble mean(List<Sample> samples, String field) {
    return samples.stream().mapToDouble(s -> s.field(field)).average();
  }
}
