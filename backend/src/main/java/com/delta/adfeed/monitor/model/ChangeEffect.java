package com.delta.adfeed.monitor.model;

public enum ChangeEffect {
    APPLIED_LIVE,
    REQUIRES_RESTART
}
