package com.delta.adfeed.monitor.model;

import com.delta.adfeed.monitor.util.HashUtils;

import java.time.Instant;

public record AdRecord(
    String id,
    String title,
    String price,
    String url,
    Instant firstSeen,
    Instant lastChecked
) {
    public static AdRecord fromCandidate(CandidateRecord candidate, Instant seenAt) {
        return new AdRecord(
            HashUtils.md5Hex(candidate.sourceUrl()),
            candidate.title(),
            candidate.price(),
            candidate.sourceUrl(),
            seenAt,
            seenAt
        );
    }
}
