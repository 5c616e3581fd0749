package com.mk.fx.qa.dbstress.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/** Stops one schema's workload when {@code prefix} is present, every workload otherwise. */
@Data
public class StopWorkloadRequest {

  @JsonProperty("prefix")
  private String prefix;
}
