package com.mk.fx.qa.dbstress.operation;

/** Why an operation ended in {@link OperationState#FAILED}. */
public enum FailureCause {
  /** The engine pushed a progress of -1. */
  ENGINE_REPORTED,
  /** The engine rejected the request or could not be reached. */
  REMOTE_REQUEST_FAILED,
  /** No terminal outcome within the caller-computed budget. */
  TIMEOUT
}
