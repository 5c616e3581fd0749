package com.mk.fx.qa.dbstress.experiment;

import java.util.Arrays;

public enum VariantId {
  A,
  B;

  public static VariantId fromValue(String value) {
    return Arrays.stream(values())
        .filter(v -> v.name().equalsIgnoreCase(value == null ? "" : value.trim()))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown variant: " + value));
  }
}
