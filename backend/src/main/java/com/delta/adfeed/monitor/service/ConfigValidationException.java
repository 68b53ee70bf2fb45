package com.delta.adfeed.monitor.service;

import java.util.List;

public class ConfigValidationException extends RuntimeException {
    private final List<String> violations;

    public ConfigValidationException(List<String> violations) {
        super("Invalid configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
