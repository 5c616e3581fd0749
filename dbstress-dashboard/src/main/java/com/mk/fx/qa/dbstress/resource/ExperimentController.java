package com.mk.fx.qa.dbstress.resource;

import com.mk.fx.qa.dbstress.dto.request.ExperimentRequest;
import com.mk.fx.qa.dbstress.dto.response.ActionResponse;
import com.mk.fx.qa.dbstress.dto.response.ExperimentResponse;
import com.mk.fx.qa.dbstress.experiment.ExperimentRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Experiments", description = "A/B comparison of two workload configurations")
@RestController
@RequestMapping("/api/experiment")
@Validated
@RequiredArgsConstructor
public class ExperimentController {

  private final ExperimentRunner experimentRunner;
  private final DashboardMapper mapper;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Run an experiment",
      description = "Runs variant A then variant B, each with a warm-up and a measurement phase.")
  @PostMapping
  public ResponseEntity<ActionResponse> run(@Valid @RequestBody ExperimentRequest request) {
    var config = mapper.toExperimentConfig(request);
    experimentRunner
        .run(config)
        .whenComplete(
            (result, failure) -> {
              if (failure != null) {
                log.error("Experiment failed: {}", failure.getMessage(), failure);
              }
            });
    return responseFactory.accepted(
        ActionResponse.ok(
            "Experiment started: "
                + config.variantA().label()
                + " vs "
                + config.variantB().label()));
  }

  @Operation(summary = "Stop the experiment", description = "Best-effort stop of the running run.")
  @PostMapping("/stop")
  public ResponseEntity<ActionResponse> stop() {
    if (!experimentRunner.stop()) {
      return responseFactory.ok(ActionResponse.refused("No experiment running"));
    }
    return responseFactory.ok(ActionResponse.ok("Experiment stop requested"));
  }

  @Operation(summary = "Experiment state", description = "Current phase and the latest result.")
  @GetMapping
  public ResponseEntity<ExperimentResponse> get() {
    return responseFactory.ok(
        new ExperimentResponse(
            experimentRunner.status(), experimentRunner.experimentResult().orElse(null)));
  }
}
