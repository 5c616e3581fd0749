package com.mk.fx.qa.dbstress.session;

import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.Sample;
import com.mk.fx.qa.dbstress.model.WorkloadConfig;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/** The first-started session together with its latest totals and both series windows. */
public record PrimaryView(
    EntityKey key,
    boolean active,
    WorkloadConfig config,
    Duration uptime,
    Map<String, Double> totals,
    List<Sample> throughput,
    List<Sample> operations) {

  public PrimaryView {
    totals = Map.copyOf(totals);
    throughput = List.copyOf(throughput);
    operations = List.copyOf(operations);
  }
}
