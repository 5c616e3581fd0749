package com.mk.fx.qa.dbstress.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class DropSchemaRequest {

  @JsonProperty("prefix")
  private String prefix;
}
