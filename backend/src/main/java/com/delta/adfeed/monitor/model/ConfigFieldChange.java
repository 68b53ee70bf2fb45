package com.delta.adfeed.monitor.model;

public record ConfigFieldChange(String field, ChangeEffect effect) {
}
