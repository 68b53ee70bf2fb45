package com.delta.adfeed.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Projects the restart-only fields of the config document (server binding, log file, database name)
 * into Spring properties before the context starts. Everything else in the document is owned by
 * {@link com.delta.adfeed.monitor.service.MonitorConfigService} once the context is up.
 */
public final class BootstrapSettings {
    private static final Logger log = LoggerFactory.getLogger(BootstrapSettings.class);

    public static final String CONFIG_FILE_ENV = "CONFIG_FILE";
    public static final String DEFAULT_CONFIG_FILE = "config.json";
    public static final String DEFAULT_SERVER_IP = "0.0.0.0";
    public static final int DEFAULT_SERVER_PORT = 5000;
    public static final String DEFAULT_LOG_FILENAME = "ad-feed-monitor.log";
    public static final String DEFAULT_DATABASE_NAME = "ad-feed.db";

    private BootstrapSettings() {
    }

    public static Path resolveConfigPath() {
        String fromEnv = System.getenv(CONFIG_FILE_ENV);
        return Path.of(fromEnv == null || fromEnv.isBlank() ? DEFAULT_CONFIG_FILE : fromEnv.trim());
    }

    public static Map<String, Object> fromConfigDocument(Path configFile) {
        String serverIp = DEFAULT_SERVER_IP;
        int serverPort = DEFAULT_SERVER_PORT;
        String logFilename = DEFAULT_LOG_FILENAME;
        String databaseName = DEFAULT_DATABASE_NAME;

        if (configFile != null && Files.isRegularFile(configFile)) {
            try {
                JsonNode root = new ObjectMapper().readTree(configFile.toFile());
                serverIp = textOr(root, "server_ip", serverIp);
                serverPort = root.path("server_port").canConvertToInt() && root.path("server_port").asInt() > 0
                    ? root.path("server_port").asInt()
                    : serverPort;
                logFilename = textOr(root, "log_filename", logFilename);
                databaseName = textOr(root, "database_name", databaseName);
            } catch (IOException e) {
                log.warn("Unable to read bootstrap settings from {}; using defaults", configFile, e);
            }
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("monitor.config-file", configFile == null ? DEFAULT_CONFIG_FILE : configFile.toString());
        properties.put("monitor.bootstrap.server-ip", serverIp);
        properties.put("monitor.bootstrap.server-port", serverPort);
        properties.put("monitor.bootstrap.log-filename", logFilename);
        properties.put("monitor.bootstrap.datasource-url", h2FileUrl(databaseName));
        return properties;
    }

    static String h2FileUrl(String databaseName) {
        String name = databaseName == null || databaseName.isBlank() ? DEFAULT_DATABASE_NAME : databaseName.trim();
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".mv.db")) {
            name = name.substring(0, name.length() - ".mv.db".length());
        } else if (lower.endsWith(".db")) {
            name = name.substring(0, name.length() - ".db".length());
        }
        if (!name.startsWith("/") && !name.startsWith("./") && !name.startsWith("~")) {
            name = "./" + name;
        }
        return "jdbc:h2:file:" + name + ";DB_CLOSE_ON_EXIT=FALSE";
    }

    private static String textOr(JsonNode root, String field, String fallback) {
        JsonNode node = root.path(field);
        if (node.isTextual() && !node.asText().isBlank()) {
            return node.asText().trim();
        }
        return fallback;
    }
}
