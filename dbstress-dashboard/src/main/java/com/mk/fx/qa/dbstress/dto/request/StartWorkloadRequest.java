package com.mk.fx.qa.dbstress.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class StartWorkloadRequest {

  @Valid
  @NotEmpty
  @JsonProperty("schemas")
  private List<SchemaWorkloadRequest> schemas = new ArrayList<>();
}
