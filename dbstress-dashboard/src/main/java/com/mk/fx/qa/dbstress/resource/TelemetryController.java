package com.mk.fx.qa.dbstress.resource;

import com.mk.fx.qa.dbstress.dto.response.SeriesResponse;
import com.mk.fx.qa.dbstress.model.Channel;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.telemetry.SystemSnapshot;
import com.mk.fx.qa.dbstress.telemetry.TelemetryNormalizer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Telemetry", description = "Bounded telemetry series and the latest system snapshot")
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class TelemetryController {

  private final TelemetryNormalizer normalizer;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Series window",
      description = "Latest samples for a schema and channel; 'default' reads the primary schema.")
  @GetMapping("/{key}/{channel}")
  public ResponseEntity<SeriesResponse> series(
      @PathVariable String key, @PathVariable String channel) {
    var entityKey = EntityKey.of(key);
    var resolvedChannel = Channel.fromValue(channel);
    return responseFactory.ok(
        new SeriesResponse(
            entityKey, resolvedChannel, normalizer.snapshot(entityKey, resolvedChannel)));
  }

  @Operation(summary = "Latest totals", description = "Cumulative operation counts of a schema.")
  @GetMapping("/totals/{key}")
  public ResponseEntity<Map<String, Double>> totals(@PathVariable String key) {
    return responseFactory.ok(normalizer.currentTotals(EntityKey.of(key)));
  }

  @Operation(summary = "System snapshot", description = "Latest wait events and database stats.")
  @GetMapping("/system")
  public ResponseEntity<SystemSnapshot> system() {
    return normalizer
        .latestSystemSnapshot()
        .map(responseFactory::ok)
        .orElseGet(() -> ResponseEntity.noContent().build());
  }
}
