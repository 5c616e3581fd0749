package com.mk.fx.qa.dbstress.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.mk.fx.qa.dbstress.catalog.EntityInfo;
import com.mk.fx.qa.dbstress.engine.client.EngineCallException;
import com.mk.fx.qa.dbstress.engine.client.EngineHttpClient;
import com.mk.fx.qa.dbstress.engine.client.EngineRequest;
import com.mk.fx.qa.dbstress.engine.client.EngineResponse;
import com.mk.fx.qa.dbstress.engine.client.JsonUtil;
import com.mk.fx.qa.dbstress.error.RemoteRequestFailedException;
import com.mk.fx.qa.dbstress.experiment.ExperimentConfig;
import com.mk.fx.qa.dbstress.experiment.Variant;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.SizeParams;
import com.mk.fx.qa.dbstress.model.WorkloadConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;

/** {@link EngineGateway} over the engine's JSON HTTP API. */
@Slf4j
public class HttpEngineGateway implements EngineGateway {

  private final EngineHttpClient client;

  public HttpEngineGateway(EngineHttpClient client) {
    this.client = client;
  }

  @Override
  public void startWorkload(Map<EntityKey, WorkloadConfig> configsByKey) {
    List<Map<String, Object>> schemas = new ArrayList<>();
    configsByKey.forEach((key, config) -> schemas.add(workloadBody(key, config)));
    send(EngineRequest.post("/api/stress/start", Map.of("schemas", schemas)), "start workload");
  }

  @Override
  public void stopWorkload() {
    send(EngineRequest.post("/api/stress/stop", Map.of()), "stop workload");
  }

  @Override
  public void stopWorkload(EntityKey key) {
    send(
        EngineRequest.post("/api/stress/stop", Map.of("prefix", key.value())),
        "stop workload " + key);
  }

  @Override
  public CompletableFuture<Void> reconfigure(EntityKey key, WorkloadConfig config, long revision) {
    var body = workloadBody(key, config);
    body.put("revision", revision);
    return sendAsync(EngineRequest.put("/api/stress/config", body), "reconfigure " + key);
  }

  @Override
  public CompletableFuture<Void> createEntity(EntityKey id, SizeParams sizeParams, Duration timeout) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("prefix", id.value());
    body.put("scaleFactor", sizeParams.scaleFactor());
    body.put("parallelism", sizeParams.parallelism());
    body.put("compress", sizeParams.compress());
    return sendAsync(
        EngineRequest.post("/api/schema/create", body).withTimeout(timeout), "create schema " + id);
  }

  @Override
  public CompletableFuture<Void> dropEntity(EntityKey id, Duration timeout) {
    return sendAsync(
        EngineRequest.post("/api/schema/drop", Map.of("prefix", id.value())).withTimeout(timeout),
        "drop schema " + id);
  }

  @Override
  public List<EntityKey> listEntities() {
    var reply = read(EngineRequest.get("/api/schemas/list", Map.of()), "list schemas");
    List<EntityKey> keys = new ArrayList<>();
    var schemas = reply.get("schemas");
    if (schemas == null || !schemas.isArray()) {
      return keys;
    }
    for (var node : schemas) {
      var prefix = node.isObject() ? firstText(node, "prefix", "name") : node.asText();
      if (prefix != null) {
        keys.add(EntityKey.of(prefix));
      }
    }
    return keys;
  }

  @Override
  public EntityInfo entityInfo(EntityKey id) {
    var reply =
        read(
            EngineRequest.get("/api/schema/info", Map.of("prefix", id.value())),
            "schema info " + id);
    List<EntityInfo.TableStats> tables = new ArrayList<>();
    var rows = reply.get("tables");
    if (rows != null && rows.isArray()) {
      for (var row : rows) {
        tables.add(
            new EntityInfo.TableStats(
                firstText(row, "TABLE_NAME", "tableName", "name"),
                row.path("NUM_ROWS").asLong(row.path("numRows").asLong()),
                row.path("BLOCKS").asLong(row.path("blocks").asLong()),
                row.path("AVG_ROW_LEN").asLong(row.path("avgRowLen").asLong())));
      }
    }
    Map<String, Long> counts = new LinkedHashMap<>();
    var countsNode = reply.get("counts");
    if (countsNode != null && countsNode.isObject()) {
      countsNode.fields().forEachRemaining(e -> counts.put(e.getKey(), e.getValue().asLong()));
    }
    return new EntityInfo(
        id,
        reply.path("schemaExists").asBoolean(!tables.isEmpty()),
        tables,
        counts,
        reply.path("totalSizeMB").asDouble(),
        reply.hasNonNull("error") ? reply.get("error").asText() : null);
  }

  @Override
  public void runExperiment(ExperimentConfig config) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("runA", variantBody(config.variantA()));
    body.put("runB", variantBody(config.variantB()));
    body.put("order", "SEQUENTIAL");
    body.put("warmupSeconds", config.warmupSeconds());
    body.put("measurementSeconds", config.measurementSeconds());
    send(EngineRequest.post("/api/experiment/start", body), "run experiment");
  }

  @Override
  public void stopExperiment() {
    send(EngineRequest.post("/api/experiment/stop", Map.of()), "stop experiment");
  }

  private void send(EngineRequest request, String action) {
    execute(request, action);
  }

  private JsonNode read(EngineRequest request, String action) {
    var body = execute(request, action).getBody();
    if (body == null || body.isBlank()) {
      return MissingNode.getInstance();
    }
    try {
      return JsonUtil.readTree(body);
    } catch (JsonProcessingException ex) {
      log.warn("Engine reply to '{}' is not JSON: {}", action, ex.getOriginalMessage());
      throw new RemoteRequestFailedException(
          action + " returned an unreadable reply: " + ex.getOriginalMessage(), ex);
    }
  }

  private EngineResponse execute(EngineRequest request, String action) {
    EngineResponse response;
    try {
      response = client.execute(request);
    } catch (EngineCallException ex) {
      log.warn("Engine call '{}' failed: {}", action, ex.getMessage());
      throw new RemoteRequestFailedException(action + " failed: " + ex.getMessage(), ex);
    }
    checkReply(response, action);
    return response;
  }

  private CompletableFuture<Void> sendAsync(EngineRequest request, String action) {
    return client
        .executeAsync(request)
        .handle(
            (response, throwable) -> {
              if (throwable != null) {
                var cause = unwrap(throwable);
                log.warn("Engine call '{}' failed: {}", action, cause.getMessage());
                throw new RemoteRequestFailedException(
                    action + " failed: " + cause.getMessage(), cause);
              }
              checkReply(response, action);
              return null;
            });
  }

  private void checkReply(EngineResponse response, String action) {
    if (response.isSuccessful()) {
      log.debug("Engine accepted '{}' in {} ms", action, response.getResponseTimeMs());
      return;
    }
    var message = engineMessage(response);
    log.warn("Engine rejected '{}' with status {}: {}", action, response.getStatusCode(), message);
    throw new RemoteRequestFailedException(message, response.getStatusCode());
  }

  static String engineMessage(EngineResponse response) {
    var body = response.getBody();
    if (body == null || body.isBlank()) {
      return "Engine returned status " + response.getStatusCode();
    }
    try {
      var node = JsonUtil.readTree(body);
      if (node.hasNonNull("message")) {
        return node.get("message").asText();
      }
    } catch (JsonProcessingException notJson) {
      log.debug("Engine reply is not JSON: {}", notJson.getOriginalMessage());
    }
    return body;
  }

  private static String firstText(JsonNode node, String... fields) {
    for (var field : fields) {
      if (node.hasNonNull(field)) {
        return node.get(field).asText();
      }
    }
    return null;
  }

  private static Throwable unwrap(Throwable throwable) {
    return throwable instanceof CompletionException && throwable.getCause() != null
        ? throwable.getCause()
        : throwable;
  }

  private static Map<String, Object> workloadBody(EntityKey key, WorkloadConfig config) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("prefix", key.value());
    body.put("sessions", config.sessions());
    body.put("insertsPerSecond", config.insertsPerSecond());
    body.put("updatesPerSecond", config.updatesPerSecond());
    body.put("deletesPerSecond", config.deletesPerSecond());
    body.put("selectsPerSecond", config.selectsPerSecond());
    body.put("thinkTime", config.thinkTimeMs());
    return body;
  }

  private static Map<String, Object> variantBody(Variant variant) {
    var body = workloadBody(variant.entityKey(), variant.workload());
    body.put("runId", variant.label());
    return body;
  }
}
