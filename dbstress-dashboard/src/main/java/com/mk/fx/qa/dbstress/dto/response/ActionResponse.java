package com.mk.fx.qa.dbstress.dto.response;

/** Acknowledgement of a control action, in the shape the engine itself replies with. */
public record ActionResponse(boolean success, String message) {

  public static ActionResponse ok(String message) {
    return new ActionResponse(true, message);
  }

  public static ActionResponse refused(String message) {
    return new ActionResponse(false, message);
  }
}
