package com.mk.fx.qa.dbstress.experiment;

public enum ExperimentPhase {
  IDLE,
  WARMUP,
  MEASUREMENT,
  COMPLETED,
  STOPPED
}
