package com.delta.adfeed.monitor.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record PageFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
