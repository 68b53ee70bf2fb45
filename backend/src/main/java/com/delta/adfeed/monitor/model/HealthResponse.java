package com.delta.adfeed.monitor.model;

import java.time.Instant;

public record HealthResponse(
    String status,
    Instant timestamp,
    String database,
    long uptimeSecs,
    boolean dbConnectivity,
    long storedAds
) {
}
