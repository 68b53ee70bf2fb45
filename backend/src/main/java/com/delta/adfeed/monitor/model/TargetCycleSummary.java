package com.delta.adfeed.monitor.model;

public record TargetCycleSummary(
    String targetUrl,
    int candidatesCount,
    int acceptedCount,
    int insertedCount,
    int updatedCount,
    int storageErrorsCount,
    String error
) {
    public static TargetCycleSummary failed(String targetUrl, String error) {
        return new TargetCycleSummary(targetUrl, 0, 0, 0, 0, 0, error);
    }

    public boolean succeeded() {
        return error == null && storageErrorsCount == 0;
    }
}
