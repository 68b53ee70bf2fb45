package com.delta.adfeed.monitor.model;

public record CandidateRecord(
    String title,
    String price,
    String sourceUrl,
    String originTarget
) {
}
