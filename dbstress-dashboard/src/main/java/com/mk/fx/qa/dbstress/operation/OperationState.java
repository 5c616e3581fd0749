package com.mk.fx.qa.dbstress.operation;

public enum OperationState {
  PENDING,
  RUNNING,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }
}
