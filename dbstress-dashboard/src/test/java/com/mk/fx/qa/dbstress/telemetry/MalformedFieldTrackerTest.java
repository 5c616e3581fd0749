package com.mk.fx.qa.dbstress.telemetry;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class MalformedFieldTrackerTest {

  @Test
  void record_countsPerField_andUnknownOnBlank() {
    var t = new MalformedFieldTracker();
    t.record("tps", "\"x\"");
    t.record("tps", "true");
    t.record("", "{}");
    t.record(null, "[]");

    assertEquals(4, t.totalMalformed());
    var breakdown = t.breakdownSnapshot();
    assertEquals(2L, breakdown.get("tps"));
    assertEquals(2L, breakdown.get("UNKNOWN"));
  }

  @Test
  void samples_areCappedAtFive() {
    var t = new MalformedFieldTracker();
    for (int i = 0; i < 12; i++) {
      t.record("field" + i, "bad");
    }

    assertEquals(12, t.totalMalformed());
    assertEquals(5, t.samplesSnapshot().size());
    assertEquals("field0", t.samplesSnapshot().get(0).field());
  }
}
