package com.mk.fx.qa.dbstress.resource;

import com.mk.fx.qa.dbstress.catalog.CatalogSnapshot;
import com.mk.fx.qa.dbstress.catalog.EntityInfo;
import com.mk.fx.qa.dbstress.catalog.SchemaCatalog;
import com.mk.fx.qa.dbstress.dto.request.BatchCreateRequest;
import com.mk.fx.qa.dbstress.dto.request.CreateSchemaRequest;
import com.mk.fx.qa.dbstress.dto.request.DropSchemaRequest;
import com.mk.fx.qa.dbstress.dto.response.BatchCreateResponse;
import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.operation.OperationOutcome;
import com.mk.fx.qa.dbstress.operation.OperationTracker;
import com.mk.fx.qa.dbstress.operation.ProvisioningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@Tag(name = "Schemas", description = "Provision and drop test schemas, follow their progress")
@RestController
@RequestMapping("/api/schema")
@Validated
@RequiredArgsConstructor
public class SchemaController {

  private final ProvisioningService provisioningService;
  private final OperationTracker operationTracker;
  private final SchemaCatalog catalog;
  private final DashboardMapper mapper;
  private final ApiResponseFactory responseFactory;

  @Operation(
      summary = "Create a schema",
      description = "Starts creating and populating a schema. Progress is polled per id.")
  @PostMapping("/create")
  public ResponseEntity<OperationOutcome> create(@Valid @RequestBody CreateSchemaRequest request) {
    var id = EntityKey.of(request.getPrefix());
    var outcome = provisioningService.create(id, mapper.toSizeParams(request));
    return responseFactory.accepted(outcome);
  }

  @Operation(
      summary = "Create several schemas",
      description =
          "Starts one create per entry. With await=true the call returns once every create has"
              + " finished or timed out.")
  @PostMapping("/create-batch")
  public ResponseEntity<BatchCreateResponse> createBatch(
      @Valid @RequestBody BatchCreateRequest request) throws InterruptedException {
    var submission = provisioningService.createAll(mapper.toSizesByKey(request.getSchemas()));
    Map<EntityKey, OperationOutcome> outcomes =
        request.isAwait() ? provisioningService.awaitBatch(submission) : Map.of();
    log.info(
        "Batch create: started={} rejected={} awaited={}",
        submission.startedIds(),
        submission.rejected().keySet(),
        request.isAwait());
    var body =
        new BatchCreateResponse(
            submission.started(),
            submission.rejected(),
            submission.budget().toMillis(),
            outcomes);
    return request.isAwait() ? responseFactory.ok(body) : responseFactory.accepted(body);
  }

  @Operation(summary = "Drop a schema", description = "Starts dropping a schema's tables.")
  @PostMapping("/drop")
  public ResponseEntity<OperationOutcome> drop(@RequestBody DropSchemaRequest request) {
    return responseFactory.accepted(provisioningService.drop(EntityKey.of(request.getPrefix())));
  }

  @Operation(summary = "List operations", description = "All create and drop operations.")
  @GetMapping("/operations")
  public ResponseEntity<List<OperationOutcome>> operations() {
    return responseFactory.ok(operationTracker.operations());
  }

  @Operation(summary = "Operation state", description = "Latest state of one schema's operation.")
  @GetMapping("/operations/{id}")
  public ResponseEntity<OperationOutcome> operation(@PathVariable String id) {
    return operationTracker
        .operationState(EntityKey.of(id))
        .map(responseFactory::ok)
        .orElseGet(
            () -> {
              log.warn("No operation recorded for {}", id);
              return ResponseEntity.notFound().build();
            });
  }

  @Operation(
      summary = "Schema catalog",
      description = "Schemas held by the engine as of the last refresh.")
  @GetMapping("/list")
  public ResponseEntity<CatalogSnapshot> list() {
    return responseFactory.ok(catalog.current());
  }

  @Operation(
      summary = "Schema details",
      description = "Tables, row counts and size of one schema, read from the engine.")
  @GetMapping("/info")
  public ResponseEntity<EntityInfo> info(@RequestParam(defaultValue = "") String prefix) {
    return responseFactory.ok(catalog.info(EntityKey.of(prefix)));
  }
}
