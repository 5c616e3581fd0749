package com.mk.fx.qa.dbstress.resource;

import com.mk.fx.qa.dbstress.dto.request.StartWorkloadRequest;
import com.mk.fx.qa.dbstress.dto.request.StopWorkloadRequest;
import com.mk.fx.qa.dbstress.dto.request.WorkloadConfigRequest;
import com.mk.fx.qa.dbstress.dto.response.ActionResponse;
import com.mk.fx.qa.dbstress.dto.response.StartWorkloadResponse;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.session.PrimaryView;
import com.mk.fx.qa.dbstress.session.SessionController;
import com.mk.fx.qa.dbstress.session.SessionStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Stress Workload", description = "Start, stop and tune per-schema stress workloads")
@RestController
@RequestMapping("/api/stress")
@Validated
@RequiredArgsConstructor
public class WorkloadController {

  private final SessionController sessionController;
  private final DashboardMapper mapper;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Start workloads",
      description = "Starts one workload per listed schema. Fails if any of them is running.")
  @PostMapping("/start")
  public ResponseEntity<StartWorkloadResponse> start(
      @Valid @RequestBody StartWorkloadRequest request) {
    var configs = mapper.toWorkloadsByKey(request.getSchemas());
    log.info("Start requested for {}", configs.keySet());
    sessionController.start(configs);
    return responseFactory.ok(
        new StartWorkloadResponse(true, "Stress test started", List.copyOf(configs.keySet())));
  }

  @Operation(
      summary = "Stop workloads",
      description = "Stops the given schema, or every workload when no prefix is sent.")
  @PostMapping("/stop")
  public ResponseEntity<ActionResponse> stop(
      @RequestBody(required = false) StopWorkloadRequest request) {
    if (request == null || request.getPrefix() == null) {
      sessionController.stop();
    } else {
      sessionController.stop(EntityKey.of(request.getPrefix()));
    }
    return responseFactory.ok(ActionResponse.ok("Stress test stopped"));
  }

  @Operation(
      summary = "Update a running workload",
      description = "Replaces the rates of a running schema; the latest update wins.")
  @PutMapping("/config/{key}")
  public ResponseEntity<?> reconfigure(
      @PathVariable String key, @Valid @RequestBody WorkloadConfigRequest request) {
    var entityKey = EntityKey.of(key);
    var applied = sessionController.reconfigure(entityKey, mapper.toWorkloadConfig(request));
    if (!applied) {
      return responseFactory.error(
          HttpStatus.BAD_REQUEST, "Not Running", "No stress test running for " + entityKey);
    }
    return responseFactory.ok(ActionResponse.ok("Configuration updated"));
  }

  @Operation(summary = "Workload status", description = "Running flag and per-schema uptime.")
  @GetMapping("/status")
  public ResponseEntity<SessionStatus> status() {
    return responseFactory.ok(sessionController.status());
  }

  @Operation(
      summary = "Primary workload view",
      description = "Config, uptime, totals and series of the first started schema.")
  @GetMapping("/primary")
  public ResponseEntity<PrimaryView> primary() {
    return sessionController
        .primaryView()
        .map(responseFactory::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }
}
