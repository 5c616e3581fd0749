package com.mk.fx.qa.dbstress.cfg;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "dbstress")
public class DashboardProperties {

  @Valid private Series series = new Series();
  @Valid private Events events = new Events();
  @Valid private Engine engine = new Engine();
  @Valid private Operations operations = new Operations();

  @Data
  public static class Series {
    /** Samples kept per entity and channel. */
    @Min(1)
    @Max(3600)
    private int capacity = 60;
  }

  @Data
  public static class Events {
    @Positive private int queueCapacity = 1000;
  }

  @Data
  public static class Engine {
    @NotBlank private String baseUrl = "http://localhost:3001";
    @Positive private int connectTimeoutSeconds = 5;
    @Positive private int requestTimeoutSeconds = 30;
  }

  @Data
  public static class Operations {
    @Positive private long baseTimeoutMs = 60_000;
    @Min(0)
    private long perUnitTimeoutMs = 30_000;
    @Positive private long hardCapTimeoutMs = 600_000;
  }
}
