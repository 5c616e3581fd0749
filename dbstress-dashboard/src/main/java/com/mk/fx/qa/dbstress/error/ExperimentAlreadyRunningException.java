package com.mk.fx.qa.dbstress.error;

public class ExperimentAlreadyRunningException extends DashboardException {

  public ExperimentAlreadyRunningException() {
    super("An experiment is already running");
  }
}
