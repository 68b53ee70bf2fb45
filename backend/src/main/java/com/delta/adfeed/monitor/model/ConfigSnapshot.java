package com.delta.adfeed.monitor.model;

import com.delta.adfeed.config.BootstrapSettings;

import java.time.Duration;
import java.util.List;

/**
 * Validated, immutable configuration. Only produced by the config service after validation;
 * replaced wholesale on every accepted update.
 */
public record ConfigSnapshot(
    String serverIp,
    int serverPort,
    String currency,
    int refreshIntervalMinutes,
    String logFilename,
    String databaseName,
    List<Target> targets
) {
    public static final String DEFAULT_CURRENCY = "$";
    public static final int DEFAULT_REFRESH_INTERVAL_MINUTES = 15;

    public ConfigSnapshot {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static ConfigSnapshot defaults() {
        return new ConfigSnapshot(
            BootstrapSettings.DEFAULT_SERVER_IP,
            BootstrapSettings.DEFAULT_SERVER_PORT,
            DEFAULT_CURRENCY,
            DEFAULT_REFRESH_INTERVAL_MINUTES,
            BootstrapSettings.DEFAULT_LOG_FILENAME,
            BootstrapSettings.DEFAULT_DATABASE_NAME,
            List.of()
        );
    }

    public Duration refreshInterval() {
        return Duration.ofMinutes(refreshIntervalMinutes);
    }
}
