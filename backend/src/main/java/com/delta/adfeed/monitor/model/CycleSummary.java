package com.delta.adfeed.monitor.model;

import java.time.Instant;
import java.util.List;

public record CycleSummary(
    long cycleNumber,
    Instant startedAt,
    Instant finishedAt,
    String status,
    List<TargetCycleSummary> targets,
    int prunedCount
) {
    public int insertedCount() {
        return targets == null ? 0 : targets.stream().mapToInt(TargetCycleSummary::insertedCount).sum();
    }
}
