package com.delta.adfeed.monitor.model;

public enum UpsertOutcome {
    INSERTED,
    UPDATED
}
