package com.mk.fx.qa.dbstress.experiment;

import com.mk.fx.qa.dbstress.model.Sample;
import java.util.List;

/**
 * Measurement-phase samples of one variant and their means. {@code meanEfficiency} is null when
 * no sample carried an efficiency figure.
 */
public record VariantResult(
    String label,
    List<Sample> samples,
    double meanThroughput,
    double meanResponseTime,
    Double meanEfficiency) {

  public VariantResult {
    samples = List.copyOf(samples);
  }
}
