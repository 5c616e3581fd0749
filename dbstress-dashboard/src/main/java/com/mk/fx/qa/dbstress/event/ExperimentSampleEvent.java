package com.mk.fx.qa.dbstress.event;

import com.mk.fx.qa.dbstress.experiment.ExperimentReducer;
import com.mk.fx.qa.dbstress.experiment.VariantId;
import com.mk.fx.qa.dbstress.model.Sample;
import java.time.Instant;
import java.util.HashMap;

/** One per-second measurement of the variant the engine is currently driving. */
public record ExperimentSampleEvent(
    VariantId variant,
    double throughput,
    double responseTimeMs,
    Double efficiency,
    Instant timestamp)
    implements EngineEvent {

  @Override
  public <R> R accept(Visitor<R> visitor) {
    return visitor.visitExperimentSample(this);
  }

  public Sample toSample() {
    var fields = new HashMap<String, Double>();
    fields.put(ExperimentReducer.THROUGHPUT, throughput);
    fields.put(ExperimentReducer.RESPONSE_TIME, responseTimeMs);
    if (efficiency != null) {
      fields.put(ExperimentReducer.EFFICIENCY, efficiency);
    }
    return new Sample(timestamp, fields);
  }
}
