package com.mk.fx.qa.dbstress.dto.response;

import com.mk.fx.qa.dbstress.model.EntityKey;
import com.mk.fx.qa.dbstress.operation.OperationOutcome;
import java.util.List;
import java.util.Map;

/**
 * Result of a batch create. {@code outcomes} holds terminal states when the caller asked to wait,
 * and is empty otherwise.
 */
public record BatchCreateResponse(
    List<OperationOutcome> started,
    Map<EntityKey, String> rejected,
    long budgetMs,
    Map<EntityKey, OperationOutcome> outcomes) {}
