package com.mk.fx.qa.dbstress.experiment;

import java.time.Duration;
import java.util.Objects;

public record ExperimentConfig(
    Variant variantA, Variant variantB, int warmupSeconds, int measurementSeconds) {

  public ExperimentConfig {
    Objects.requireNonNull(variantA, "variantA");
    Objects.requireNonNull(variantB, "variantB");
    if (warmupSeconds < 0) {
      throw new IllegalArgumentException("warmupSeconds must not be negative");
    }
    if (measurementSeconds < 1) {
      throw new IllegalArgumentException("measurementSeconds must be >= 1");
    }
  }

  public Variant variant(VariantId id) {
    return id == VariantId.A ? variantA : variantB;
  }

  public Duration warmup() {
    return Duration.ofSeconds(warmupSeconds);
  }

  public Duration measurement() {
    return Duration.ofSeconds(measurementSeconds);
  }
}
