package com.mk.fx.qa.dbstress.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.dbstress.dto.response.ActionResponse;
import com.mk.fx.qa.dbstress.event.EngineEventLoop;
import com.mk.fx.qa.dbstress.event.EngineEventParser;
import com.mk.fx.qa.dbstress.event.EngineEventType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Receives pushes from the execution engine and queues them for the event loop. */
@Slf4j
@Tag(name = "Engine Events", description = "Push endpoints called by the execution engine")
@RestController
@RequestMapping("/api/engine/events")
@RequiredArgsConstructor
public class EngineEventController {

  private final EngineEventParser parser;
  private final EngineEventLoop eventLoop;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Push an engine event",
      description =
          "Accepts telemetry, progress, system, experiment-sample and workload-stopped events.")
  @PostMapping("/{type}")
  public ResponseEntity<ActionResponse> push(
      @PathVariable String type, @RequestBody JsonNode payload) {
    var event = parser.parse(EngineEventType.fromPath(type), payload);
    if (!eventLoop.submit(event)) {
      return responseFactory.unavailable(ActionResponse.refused("Event queue full"));
    }
    return responseFactory.accepted(ActionResponse.ok("Queued"));
  }
}
