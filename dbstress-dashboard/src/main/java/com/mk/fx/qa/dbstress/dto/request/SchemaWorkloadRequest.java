package com.mk.fx.qa.dbstress.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.EqualsAndHashCode;

/** Workload rates addressed to one schema prefix; a blank prefix means the default schema. */
@Data
@EqualsAndHashCode(callSuper = true)
public class SchemaWorkloadRequest extends WorkloadConfigRequest {

  @JsonProperty("prefix")
  private String prefix;
}
