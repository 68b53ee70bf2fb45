package com.delta.adfeed.monitor.model;

public record Target(String url, FilterSpec filterSpec) {
    public Target {
        filterSpec = filterSpec == null ? FilterSpec.empty() : filterSpec;
    }
}
