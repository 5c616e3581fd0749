package com.mk.fx.qa.dbstress.engine.client;

import lombok.Data;

@Data
public class EngineResponse {
  private int statusCode;
  private String body;
  private long responseTimeMs;

  public boolean isSuccessful() {
    return statusCode >= 200 && statusCode < 300;
  }
}
