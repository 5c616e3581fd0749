package com.mk.fx.qa.dbstress.model;

/**
 * Size of a schema provisioning request. {@code parallelism} is the number of tables populated in
 * parallel and drives the timeout budget.
 */
public record SizeParams(int scaleFactor, int parallelism, boolean compress) {

  public SizeParams {
    if (scaleFactor < 1) {
      throw new IllegalArgumentException("scaleFactor must be >= 1");
    }
    if (parallelism < 0) {
      throw new IllegalArgumentException("parallelism must not be negative");
    }
  }

  public int unitCount() {
    return Math.max(1, parallelism);
  }
}
