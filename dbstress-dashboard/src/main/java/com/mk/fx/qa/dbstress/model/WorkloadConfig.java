package com.mk.fx.qa.dbstress.model;

/**
 * Rate parameters applied to one entity while its workload runs. Instances are immutable; a live
 * update replaces the whole config.
 */
public record WorkloadConfig(
    int sessions,
    int insertsPerSecond,
    int updatesPerSecond,
    int deletesPerSecond,
    int selectsPerSecond,
    int thinkTimeMs) {

  public WorkloadConfig {
    if (sessions < 1) {
      throw new IllegalArgumentException("sessions must be >= 1");
    }
    if (insertsPerSecond < 0
        || updatesPerSecond < 0
        || deletesPerSecond < 0
        || selectsPerSecond < 0
        || thinkTimeMs < 0) {
      throw new IllegalArgumentException("rates and think time must not be negative");
    }
  }

  public static WorkloadConfig defaults() {
    return new WorkloadConfig(10, 50, 30, 10, 100, 50);
  }
}
