package com.mk.fx.qa.dbstress.telemetry;

public record WaitEvent(
    String event,
    String waitClass,
    double totalWaits,
    double timeWaitedSeconds,
    double averageWaitMs) {}
