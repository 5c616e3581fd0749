package com.mk.fx.qa.dbstress.engine.client;

import java.time.Duration;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single call towards the remote execution engine. {@code timeout} overrides the client's
 * default request timeout for size-dependent calls such as schema provisioning.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EngineRequest {
  private HttpMethod method;
  private String path;
  private Map<String, String> query;
  private Object body;
  private Duration timeout;

  public static EngineRequest get(String path, Map<String, String> query) {
    return new EngineRequest(HttpMethod.GET, path, query, null, null);
  }

  public static EngineRequest post(String path, Object body) {
    return new EngineRequest(HttpMethod.POST, path, null, body, null);
  }

  public static EngineRequest put(String path, Object body) {
    return new EngineRequest(HttpMethod.PUT, path, null, body, null);
  }

  public EngineRequest withTimeout(Duration timeout) {
    this.timeout = timeout;
    return this;
  }
}
