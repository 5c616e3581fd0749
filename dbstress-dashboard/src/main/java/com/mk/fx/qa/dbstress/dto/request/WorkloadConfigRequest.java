package com.mk.fx.qa.dbstress.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import lombok.Data;

/** Workload rates for one entity. Omitted fields take the dashboard defaults. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WorkloadConfigRequest {

  @Min(1)
  @JsonProperty("sessions")
  private int sessions = 10;

  @Min(0)
  @JsonProperty("insertsPerSecond")
  private int insertsPerSecond = 50;

  @Min(0)
  @JsonProperty("updatesPerSecond")
  private int updatesPerSecond = 30;

  @Min(0)
  @JsonProperty("deletesPerSecond")
  private int deletesPerSecond = 10;

  @Min(0)
  @JsonProperty("selectsPerSecond")
  private int selectsPerSecond = 100;

  @Min(0)
  @JsonProperty("thinkTime")
  private int thinkTime = 50;
}
