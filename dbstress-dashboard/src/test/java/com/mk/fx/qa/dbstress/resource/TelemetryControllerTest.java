package com.mk.fx.qa.dbstress.resource;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.series.BoundedSeriesStore;
import com.mk.fx.qa.dbstress.telemetry.EntityTelemetry;
import com.mk.fx.qa.dbstress.telemetry.SystemSnapshot;
import com.mk.fx.qa.dbstress.telemetry.TelemetryFrame;
import com.mk.fx.qa.dbstress.telemetry.TelemetryNormalizer;
import com.mk.fx.qa.dbstress.telemetry.WaitEvent;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;

class TelemetryControllerTest {

  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private TelemetryNormalizer normalizer;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    normalizer = new TelemetryNormalizer(new BoundedSeriesStore());
    mockMvc =
        MockMvcSupport.mockMvc(new TelemetryController(normalizer, new ApiResponseFactory()));
  }

  private void frame(double tps) {
    var entity = new EntityTelemetry(tps, 5, 3, 1, 9, Map.of("inserts", 500.0));
    normalizer.normalize(
        new TelemetryFrame(
            T0, TelemetryFrame.Shape.MULTI_ENTITY, Map.of(EntityKey.of("S1"), entity)));
  }

  @Test
  void series_defaultKeyReadsPrimarySchema() throws Exception {
    frame(42);
    frame(43);

    mockMvc
        .perform(get("/api/metrics/default/throughput"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.key", is("default")))
        .andExpect(jsonPath("$.samples", hasSize(2)))
        .andExpect(jsonPath("$.samples[1].fields.tps", is(43.0)));
  }

  @Test
  void series_unknownChannel_isRejected() throws Exception {
    mockMvc
        .perform(get("/api/metrics/s1/latency"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details", is("Unsupported channel: latency")));
  }

  @Test
  void totals_returnsLatestTotals() throws Exception {
    frame(10);

    mockMvc
        .perform(get("/api/metrics/totals/s1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.inserts", is(500.0)));
  }

  @Test
  void system_withoutSnapshot_returnsNoContent() throws Exception {
    mockMvc.perform(get("/api/metrics/system")).andExpect(status().isNoContent());
  }

  @Test
  void system_returnsLatestSnapshot() throws Exception {
    normalizer.acceptSystemSnapshot(
        new SystemSnapshot(
            T0,
            List.of(new WaitEvent("log file sync", "Commit", 10, 0.5, 50)),
            Map.of("cpu", 40.0),
            Map.of()));

    mockMvc
        .perform(get("/api/metrics/system"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.waitEvents[0].waitClass", is("Commit")));
  }
}
