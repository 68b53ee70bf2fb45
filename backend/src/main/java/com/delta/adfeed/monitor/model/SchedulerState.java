package com.delta.adfeed.monitor.model;

public enum SchedulerState {
    STOPPED,
    IDLE,
    RUNNING
}
