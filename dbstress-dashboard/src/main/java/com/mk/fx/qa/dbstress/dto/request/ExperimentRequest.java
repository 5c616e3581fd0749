package com.mk.fx.qa.dbstress.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/** A/B comparison request: the two variants run one after the other. */
@Data
public class ExperimentRequest {

  @Valid
  @NotNull
  @JsonProperty("runA")
  private VariantRequest runA;

  @Valid
  @NotNull
  @JsonProperty("runB")
  private VariantRequest runB;

  @Min(0)
  @Max(3600)
  @JsonProperty("warmupSeconds")
  private int warmupSeconds = 10;

  @Min(1)
  @Max(3600)
  @JsonProperty("measurementSeconds")
  private int measurementSeconds = 60;
}
