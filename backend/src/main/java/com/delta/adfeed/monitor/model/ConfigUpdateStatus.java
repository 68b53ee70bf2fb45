package com.delta.adfeed.monitor.model;

public enum ConfigUpdateStatus {
    APPLIED,
    REJECTED,
    ROLLED_BACK,
    ROLLBACK_FAILED
}
