package com.mk.fx.qa.dbstress.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.dbstress.dto.request.CreateSchemaRequest;
import com.mk.fx.qa.dbstress.dto.request.ExperimentRequest;
import com.mk.fx.qa.dbstress.dto.request.SchemaWorkloadRequest;
import com.mk.fx.qa.dbstress.dto.request.VariantRequest;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.model.SizeParams;
import com.mk.fx.qa.dbstress.model.WorkloadConfig;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

class DashboardMapperTest {

  private final DashboardMapper mapper = Mappers.getMapper(DashboardMapper.class);

  private static SchemaWorkloadRequest workload(String prefix, int sessions) {
    var request = new SchemaWorkloadRequest();
    request.setPrefix(prefix);
    request.setSessions(sessions);
    return request;
  }

  @Test
  void toWorkloadConfig_mapsThinkTime() {
    var request = workload("a", 3);
    request.setThinkTime(0);

    assertEquals(new WorkloadConfig(3, 50, 30, 10, 100, 0), mapper.toWorkloadConfig(request));
  }

  @Test
  void toWorkloadsByKey_keepsOrderAndLastDuplicate() {
    var configs =
        mapper.toWorkloadsByKey(List.of(workload("b", 1), workload("a", 2), workload("B", 7)));

    assertThat(configs.keySet()).containsExactly(EntityKey.of("B"), EntityKey.of("A"));
    assertEquals(7, configs.get(EntityKey.of("B")).sessions());
  }

  @Test
  void toSizesByKey_mapsSizeParams() {
    var request = new CreateSchemaRequest();
    request.setPrefix("s1");
    request.setScaleFactor(3);
    request.setParallelism(0);

    var sizes = mapper.toSizesByKey(List.of(request));

    assertEquals(new SizeParams(3, 0, false), sizes.get(EntityKey.of("S1")));
    assertEquals(1, sizes.get(EntityKey.of("S1")).unitCount());
  }

  @Test
  void toExperimentConfig_defaultsLabelToPrefix() {
    var runA = new VariantRequest();
    runA.setPrefix("a");
    runA.setLabel("baseline");
    var runB = new VariantRequest();
    runB.setPrefix("b");
    var request = new ExperimentRequest();
    request.setRunA(runA);
    request.setRunB(runB);

    var config = mapper.toExperimentConfig(request);

    assertEquals("baseline", config.variantA().label());
    assertEquals("B", config.variantB().label());
    assertEquals(10, config.warmupSeconds());
    assertEquals(60, config.measurementSeconds());
  }
}
