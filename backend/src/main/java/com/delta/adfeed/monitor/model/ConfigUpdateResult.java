package com.delta.adfeed.monitor.model;

import java.util.List;

public record ConfigUpdateResult(
    boolean accepted,
    ConfigUpdateStatus status,
    String message,
    List<ConfigFieldChange> changes
) {
    public ConfigUpdateResult {
        changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static ConfigUpdateResult applied(String message, List<ConfigFieldChange> changes) {
        return new ConfigUpdateResult(true, ConfigUpdateStatus.APPLIED, message, changes);
    }

    public static ConfigUpdateResult rejected(String message) {
        return new ConfigUpdateResult(false, ConfigUpdateStatus.REJECTED, message, List.of());
    }

    public static ConfigUpdateResult rolledBack(String message, List<ConfigFieldChange> changes) {
        return new ConfigUpdateResult(false, ConfigUpdateStatus.ROLLED_BACK, message, changes);
    }

    public static ConfigUpdateResult rollbackFailed(String message, List<ConfigFieldChange> changes) {
        return new ConfigUpdateResult(false, ConfigUpdateStatus.ROLLBACK_FAILED, message, changes);
    }

    public boolean requiresRestart() {
        return changes.stream().anyMatch(change -> change.effect() == ChangeEffect.REQUIRES_RESTART);
    }
}
