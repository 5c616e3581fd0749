package com.mk.fx.qa.dbstress.resource;

import com.mk.fx.qa.dbstress.dto.response.HealthResponse;
import com.mk.fx.qa.dbstress.event.EngineEventLoop;
import com.mk.fx.qa.dbstress.telemetry.MalformedFieldTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Health", description = "Service health")
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
public class HealthController {

  private final EngineEventLoop eventLoop;
  private final MalformedFieldTracker malformedFields;
  private final ApiResponseFactory responseFactory;

  @Operation(summary = "Health check", description = "Service status and event counters.")
  @GetMapping
  public ResponseEntity<HealthResponse> health() {
    var response =
        new HealthResponse(
            "UP",
            eventLoop.pending(),
            eventLoop.rejectedCount(),
            malformedFields.totalMalformed());
    log.debug("Health check: {}", response);
    return responseFactory.ok(response);
  }
}
