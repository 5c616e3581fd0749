package com.mk.fx.qa.dbstress.operation;

public enum OperationKind {
  CREATE,
  DROP
}
