package com.delta.adfeed.monitor.service;

import com.delta.adfeed.config.BootstrapSettings;
import com.delta.adfeed.monitor.filter.FilterEngine;
import com.delta.adfeed.monitor.model.ConfigSnapshot;
import com.delta.adfeed.monitor.model.Target;
import com.delta.adfeed.monitor.util.AdUrlUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a raw config document into a {@link ConfigSnapshot}. Every rule is checked and all
 * violations are reported together; nothing is returned unless the whole document is valid.
 */
@Component
public class ConfigValidator {
    private final FilterEngine filterEngine;

    public ConfigValidator(FilterEngine filterEngine) {
        this.filterEngine = filterEngine;
    }

    public ConfigSnapshot validate(JsonNode document) {
        List<String> violations = new ArrayList<>();
        if (document == null || !document.isObject()) {
            throw new ConfigValidationException(List.of("config document must be a JSON object"));
        }

        String serverIp = requiredText(document, "server_ip", violations);
        int serverPort = requiredInt(document, "server_port", violations);
        if (document.path("server_port").canConvertToInt() && (serverPort <= 0 || serverPort > 65535)) {
            violations.add("server_port must be between 1 and 65535");
        }
        String currency = optionalText(document, "currency", ConfigSnapshot.DEFAULT_CURRENCY, violations);
        int refreshInterval = optionalInt(
            document,
            "refresh_interval_minutes",
            ConfigSnapshot.DEFAULT_REFRESH_INTERVAL_MINUTES,
            violations
        );
        if (refreshInterval <= 0) {
            violations.add("refresh_interval_minutes must be greater than zero");
        }
        String logFilename = optionalText(document, "log_filename", BootstrapSettings.DEFAULT_LOG_FILENAME, violations);
        String databaseName = optionalText(document, "database_name", BootstrapSettings.DEFAULT_DATABASE_NAME, violations);
        List<Target> targets = targets(document.get("url_filters"), violations);

        if (!violations.isEmpty()) {
            throw new ConfigValidationException(violations);
        }
        return new ConfigSnapshot(serverIp, serverPort, currency, refreshInterval, logFilename, databaseName, targets);
    }

    private List<Target> targets(JsonNode urlFilters, List<String> violations) {
        if (urlFilters == null || urlFilters.isNull()) {
            return List.of();
        }
        if (!urlFilters.isObject()) {
            violations.add("url_filters must be an object keyed by target URL");
            return List.of();
        }
        List<Target> targets = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        Iterator<Map.Entry<String, JsonNode>> fields = urlFilters.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String url = entry.getKey().trim();
            if (!AdUrlUtils.hasSchemeAndHost(url)) {
                violations.add("target URL '" + url + "' must have a scheme and host");
            }
            if (!seenUrls.add(url)) {
                violations.add("target URL '" + url + "' is listed more than once");
            }
            Map<String, List<String>> levels = levels(url, entry.getValue(), violations);
            targets.add(new Target(url, filterEngine.compile(levels)));
        }
        return targets;
    }

    private Map<String, List<String>> levels(String url, JsonNode node, List<String> violations) {
        Map<String, List<String>> levels = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return levels;
        }
        if (!node.isObject()) {
            violations.add("filters for '" + url + "' must be an object of levelN entries");
            return levels;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> level = fields.next();
            if (FilterEngine.levelOrder(level.getKey()) == null) {
                violations.add("filter level '" + level.getKey() + "' for '" + url + "' must be named levelN");
                continue;
            }
            JsonNode keywords = level.getValue();
            if (keywords == null || !keywords.isArray()) {
                violations.add("filter level '" + level.getKey() + "' for '" + url + "' must be a list of strings");
                continue;
            }
            List<String> values = new ArrayList<>();
            boolean allText = true;
            for (JsonNode keyword : keywords) {
                if (!keyword.isTextual()) {
                    allText = false;
                    break;
                }
                values.add(keyword.asText());
            }
            if (!allText) {
                violations.add("filter level '" + level.getKey() + "' for '" + url + "' must be a list of strings");
                continue;
            }
            levels.put(level.getKey(), values);
        }
        return levels;
    }

    private static String requiredText(JsonNode document, String field, List<String> violations) {
        JsonNode node = document.get(field);
        if (node == null || node.isNull()) {
            violations.add(field + " is required");
            return null;
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            violations.add(field + " must be a non-empty string");
            return null;
        }
        return node.asText().trim();
    }

    private static int requiredInt(JsonNode document, String field, List<String> violations) {
        JsonNode node = document.get(field);
        if (node == null || node.isNull()) {
            violations.add(field + " is required");
            return 0;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            violations.add(field + " must be an integer");
            return 0;
        }
        return node.asInt();
    }

    private static String optionalText(JsonNode document, String field, String fallback, List<String> violations) {
        JsonNode node = document.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            violations.add(field + " must be a non-empty string");
            return fallback;
        }
        return node.asText().trim();
    }

    private static int optionalInt(JsonNode document, String field, int fallback, List<String> violations) {
        JsonNode node = document.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            violations.add(field + " must be an integer");
            return fallback;
        }
        return node.asInt();
    }
}
