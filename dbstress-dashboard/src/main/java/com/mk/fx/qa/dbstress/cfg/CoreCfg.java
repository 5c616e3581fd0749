package com.mk.fx.qa.dbstress.cfg;

import com.mk.fx.qa.dbstress.catalog.SchemaCatalog;
import com.mk.fx.qa.dbstress.core.CoreContext;
import com.mk.fx.qa.dbstress.core.CoreSettings;
import com.mk.fx.qa.dbstress.engine.EngineGateway;
import com.mk.fx.qa.dbstress.engine.HttpEngineGateway;
import com.mk.fx.qa.dbstress.engine.client.EngineHttpClient;
import com.mk.fx.qa.dbstress.event.EngineEventLoop;
import com.mk.fx.qa.dbstress.event.EngineEventParser;
import com.mk.fx.qa.dbstress.experiment.ExperimentRunner;
import com.mk.fx.qa.dbstress.experiment.SleepingPhaseTimer;
import com.mk.fx.qa.dbstress.operation.OperationTracker;
import com.mk.fx.qa.dbstress.operation.ProvisioningService;
import com.mk.fx.qa.dbstress.operation.TimeoutBudget;
import com.mk.fx.qa.dbstress.session.SessionController;
import com.mk.fx.qa.dbstress.telemetry.MalformedFieldTracker;
import com.mk.fx.qa.dbstress.telemetry.TelemetryNormalizer;
import java.time.Clock;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the single {@link CoreContext} and exposes its components to the controllers. */
@Slf4j
@Configuration
public class CoreCfg {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public EngineHttpClient engineHttpClient(DashboardProperties properties) {
    var engine = properties.getEngine();
    log.info("Engine endpoint {}", engine.getBaseUrl());
    return new EngineHttpClient(
        engine.getBaseUrl(),
        engine.getConnectTimeoutSeconds(),
        engine.getRequestTimeoutSeconds(),
        Map.of());
  }

  @Bean
  public EngineGateway engineGateway(EngineHttpClient engineHttpClient) {
    return new HttpEngineGateway(engineHttpClient);
  }

  @Bean
  public CoreContext coreContext(
      EngineGateway engineGateway, DashboardProperties properties, Clock clock) {
    var operations = properties.getOperations();
    var settings =
        new CoreSettings(
            properties.getSeries().getCapacity(),
            properties.getEvents().getQueueCapacity(),
            TimeoutBudget.ofMillis(
                operations.getBaseTimeoutMs(),
                operations.getPerUnitTimeoutMs(),
                operations.getHardCapTimeoutMs()));
    return new CoreContext(engineGateway, settings, clock, new SleepingPhaseTimer());
  }

  @Bean
  public TelemetryNormalizer telemetryNormalizer(CoreContext core) {
    return core.getNormalizer();
  }

  @Bean
  public MalformedFieldTracker malformedFieldTracker(CoreContext core) {
    return core.getMalformedFields();
  }

  @Bean
  public OperationTracker operationTracker(CoreContext core) {
    return core.getTracker();
  }

  @Bean
  public SchemaCatalog schemaCatalog(CoreContext core) {
    return core.getCatalog();
  }

  @Bean
  public ProvisioningService provisioningService(CoreContext core) {
    return core.getProvisioning();
  }

  @Bean
  public SessionController sessionController(CoreContext core) {
    return core.getSessions();
  }

  @Bean
  public ExperimentRunner experimentRunner(CoreContext core) {
    return core.getExperiments();
  }

  @Bean
  public EngineEventParser engineEventParser(CoreContext core) {
    return core.getEventParser();
  }

  @Bean
  public EngineEventLoop engineEventLoop(CoreContext core) {
    return core.getEventLoop();
  }
}
