package com.mk.fx.qa.dbstress.engine.client;

/** Raised when a call to the engine cannot be built, sent or completed in time. */
public class EngineCallException extends RuntimeException {

  private final boolean timedOut;

  public EngineCallException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public EngineCallException(String message, Throwable cause, boolean timedOut) {
    super(message, cause);
    this.timedOut = timedOut;
  }

  public boolean isTimedOut() {
    return timedOut;
  }
}
