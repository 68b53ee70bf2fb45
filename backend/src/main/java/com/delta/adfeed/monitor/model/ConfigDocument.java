package com.delta.adfeed.monitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of the config file.
 */
@JsonPropertyOrder({
    "server_ip", "server_port", "currency", "refresh_interval_minutes", "log_filename", "database_name", "url_filters"
})
public record ConfigDocument(
    @JsonProperty("server_ip") String serverIp,
    @JsonProperty("server_port") int serverPort,
    @JsonProperty("currency") String currency,
    @JsonProperty("refresh_interval_minutes") int refreshIntervalMinutes,
    @JsonProperty("log_filename") String logFilename,
    @JsonProperty("database_name") String databaseName,
    @JsonProperty("url_filters") Map<String, Map<String, List<String>>> urlFilters
) {
    public static ConfigDocument fromSnapshot(ConfigSnapshot snapshot) {
        Map<String, Map<String, List<String>>> filters = new LinkedHashMap<>();
        for (Target target : snapshot.targets()) {
            filters.put(target.url(), target.filterSpec().toLevelMap());
        }
        return new ConfigDocument(
            snapshot.serverIp(),
            snapshot.serverPort(),
            snapshot.currency(),
            snapshot.refreshIntervalMinutes(),
            snapshot.logFilename(),
            snapshot.databaseName(),
            filters
        );
    }
}
