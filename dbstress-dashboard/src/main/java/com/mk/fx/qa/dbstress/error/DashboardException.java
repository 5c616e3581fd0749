package com.mk.fx.qa.dbstress.error;

/** Base type for failures surfaced to the caller of a dashboard action. */
public abstract class DashboardException extends RuntimeException {

  protected DashboardException(String message) {
    super(message);
  }

  protected DashboardException(String message, Throwable cause) {
    super(message, cause);
  }
}
