package com.mk.fx.qa.dbstress.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("DBStress Dashboard API")
                .description(
                    "Controls database stress workloads, schema provisioning and A/B experiments,"
                        + " and serves live telemetry."));
  }
}
