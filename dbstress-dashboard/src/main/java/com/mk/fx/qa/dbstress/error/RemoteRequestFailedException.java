package com.mk.fx.qa.dbstress.error;

/**
 * The engine rejected a request or could not be reached. Carries the engine's own message and,
 * when a reply was received, its HTTP status ({@code 0} otherwise).
 */
public class RemoteRequestFailedException extends DashboardException {

  private final int statusCode;

  public RemoteRequestFailedException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public RemoteRequestFailedException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = 0;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
