package com.mk.fx.qa.dbstress.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateSchemaRequest {

  @JsonProperty("prefix")
  private String prefix;

  @Min(1)
  @JsonProperty("scaleFactor")
  private int scaleFactor = 1;

  /** Tables populated in parallel. */
  @Min(0)
  @Max(64)
  @JsonProperty("parallelism")
  private int parallelism = 10;

  @JsonProperty("compress")
  private boolean compress;
}
