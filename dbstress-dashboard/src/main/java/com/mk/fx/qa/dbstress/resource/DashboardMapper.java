package com.mk.fx.qa.dbstress.resource;

import com.mk.fx.qa.dbstress.dto.request.CreateSchemaRequest;
import com.mk.fx.qa.dbstress.dto.request.ExperimentRequest;
import com.mk.fx.qa.dbstress.dto.request.SchemaWorkloadRequest;
import com.mk.fx.qa.dbstress.dto.request.VariantRequest;
import com.mk.fx.qa.dbstress.dto.request.WorkloadConfigRequest;
import com.mk.fx.qa.dbstress.experiment.ExperimentConfig;
import com.mk.fx.qa.dbstress.experiment.Variant;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.SizeParams;
import com.mk.fx.qa.dbstress.model.WorkloadConfig;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

@Mapper(componentModel = "spring")
public interface DashboardMapper {

  @Mapping(target = "thinkTimeMs", source = "thinkTime")
  WorkloadConfig toWorkloadConfig(WorkloadConfigRequest request);

  SizeParams toSizeParams(CreateSchemaRequest request);

  @Named("toEntityKey")
  default EntityKey toEntityKey(String prefix) {
    return EntityKey.of(prefix);
  }

  /** Keeps request order; a prefix listed twice keeps its last config. */
  default Map<EntityKey, WorkloadConfig> toWorkloadsByKey(List<SchemaWorkloadRequest> schemas) {
    Map<EntityKey, WorkloadConfig> configs = new LinkedHashMap<>();
    for (var schema : schemas) {
      configs.put(toEntityKey(schema.getPrefix()), toWorkloadConfig(schema));
    }
    return configs;
  }

  default Map<EntityKey, SizeParams> toSizesByKey(List<CreateSchemaRequest> schemas) {
    Map<EntityKey, SizeParams> sizes = new LinkedHashMap<>();
    for (var schema : schemas) {
      sizes.put(toEntityKey(schema.getPrefix()), toSizeParams(schema));
    }
    return sizes;
  }

  default Variant toVariant(VariantRequest request) {
    return new Variant(
        request.getLabel(), toEntityKey(request.getPrefix()), toWorkloadConfig(request));
  }

  default ExperimentConfig toExperimentConfig(ExperimentRequest request) {
    return new ExperimentConfig(
        toVariant(request.getRunA()),
        toVariant(request.getRunB()),
        request.getWarmupSeconds(),
        request.getMeasurementSeconds());
  }
}
