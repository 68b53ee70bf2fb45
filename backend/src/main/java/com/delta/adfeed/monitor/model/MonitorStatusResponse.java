package com.delta.adfeed.monitor.model;

import java.time.Instant;

public record MonitorStatusResponse(
    SchedulerState state,
    int refreshIntervalMinutes,
    Instant nextRunAt,
    long completedCycles,
    long skippedTicks,
    CycleSummary lastCycle
) {
}
