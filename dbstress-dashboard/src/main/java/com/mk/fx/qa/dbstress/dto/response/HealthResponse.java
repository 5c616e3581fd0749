package com.mk.fx.qa.dbstress.dto.response;

/** Service health with event loop and parsing counters. */
public record HealthResponse(
    String status, int pendingEvents, long rejectedEvents, long malformedFields) {}
