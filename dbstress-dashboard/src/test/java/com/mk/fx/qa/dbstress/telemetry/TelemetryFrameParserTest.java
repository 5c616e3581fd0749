package com.mk.fx.qa.dbstress.telemetry;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.dbstress.model.EntityKey;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TelemetryFrameParserTest {

  private static final Instant RECEIVED = Instant.parse("2024-05-01T10:00:00Z");

  private final ObjectMapper mapper = new ObjectMapper();
  private MalformedFieldTracker tracker;
  private TelemetryFrameParser parser;

  @BeforeEach
  void setUp() {
    tracker = new MalformedFieldTracker();
    parser = new TelemetryFrameParser(new LenientNumberReader(tracker));
  }

  private TelemetryFrame parse(String json) throws Exception {
    return parser.parse(mapper.readTree(json), RECEIVED);
  }

  @Test
  void legacyPayload_isDecodedUnderDefaultKey() throws Exception {
    var frame =
        parse(
            "{\"tps\": 120, \"perSecond\": {\"inserts\": 50, \"updates\": 30, \"deletes\": 10,"
                + " \"selects\": 30, \"transactions\": 120}, \"total\": {\"inserts\": 500,"
                + " \"errors\": 2}}");

    assertEquals(TelemetryFrame.Shape.LEGACY, frame.shape());
    assertEquals(RECEIVED, frame.timestamp());
    var entity = frame.entities().get(EntityKey.DEFAULT);
    assertEquals(120.0, entity.throughput());
    assertEquals(50.0, entity.inserts());
    assertEquals(30.0, entity.selects());
    assertEquals(500.0, entity.totals().get("inserts"));
    assertEquals(2.0, entity.totals().get("errors"));
    assertEquals(0.0, entity.totals().get("updates"));
  }

  @Test
  void missingTps_fallsBackToTransactionsPerSecond() throws Exception {
    var frame = parse("{\"perSecond\": {\"transactions\": 77}}");

    assertEquals(77.0, frame.entities().get(EntityKey.DEFAULT).throughput());
  }

  @Test
  void multiEntityPayload_keepsWireOrder_andUsesPayloadTimestamp() throws Exception {
    var frame =
        parse(
            "{\"timestamp\": 1714557600000, \"schemas\": {\"b\": {\"tps\": 2}, \"A\": {\"tps\":"
                + " 1}}}");

    assertEquals(TelemetryFrame.Shape.MULTI_ENTITY, frame.shape());
    assertEquals(Instant.ofEpochMilli(1714557600000L), frame.timestamp());
    assertEquals(
        List.of(EntityKey.of("B"), EntityKey.of("A")), List.copyOf(frame.entities().keySet()));
    assertEquals(2.0, frame.entities().get(EntityKey.of("B")).throughput());
  }

  @Test
  void emptySchemas_yieldsEmptyFrame() throws Exception {
    var frame = parse("{\"timestamp\": 1714557600000, \"schemas\": {}}");

    assertTrue(frame.isEmpty());
    assertEquals(TelemetryFrame.Shape.MULTI_ENTITY, frame.shape());
  }

  @Test
  void schemasNotAnObject_yieldsEmptyFrame() throws Exception {
    assertTrue(parse("{\"schemas\": [1, 2]}").isEmpty());
  }

  @Test
  void malformedField_isZeroed_andRestOfEntityKept() throws Exception {
    var frame =
        parse("{\"schemas\": {\"A\": {\"tps\": \"fast\", \"perSecond\": {\"inserts\": 9}}}}");

    var entity = frame.entities().get(EntityKey.of("A"));
    assertEquals(0.0, entity.throughput());
    assertEquals(9.0, entity.inserts());
    assertEquals(1L, tracker.breakdownSnapshot().get("schemas.A.tps"));
  }

  @Test
  void keysNormalisingToSameEntity_firstWins_andCollisionIsCounted() throws Exception {
    var frame = parse("{\"schemas\": {\"a-1\": {\"tps\": 5}, \"A1\": {\"tps\": 9}}}");

    assertEquals(1, frame.entities().size());
    assertEquals(5.0, frame.entities().get(EntityKey.of("A1")).throughput());
    assertEquals(1L, tracker.totalMalformed());
    assertEquals(1L, tracker.breakdownSnapshot().get("schemas.A1"));
    assertEquals("A1", tracker.samplesSnapshot().get(0).rawValue());
  }
}
