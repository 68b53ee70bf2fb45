package com.delta.adfeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {
    private static final List<String> DEFAULT_USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/128.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:130.0) Gecko/20100101 Firefox/130.0",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/128.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/128.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:130.0) Gecko/20100101 Firefox/130.0"
    );

    private String configFile = BootstrapSettings.DEFAULT_CONFIG_FILE;
    private int retentionDays = 14;
    private Scheduler scheduler = new Scheduler();
    private Fetch fetch = new Fetch();
    private Extraction extraction = new Extraction();
    private Feed feed = new Feed();

    public String getConfigFile() {
        return configFile == null || configFile.isBlank() ? BootstrapSettings.DEFAULT_CONFIG_FILE : configFile.trim();
    }

    public void setConfigFile(String configFile) {
        this.configFile = configFile;
    }

    public int getRetentionDays() {
        return Math.max(1, retentionDays);
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = Math.max(1, retentionDays);
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Feed getFeed() {
        return feed;
    }

    public void setFeed(Feed feed) {
        this.feed = feed;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private int startupDelaySeconds = 10;
        private int shutdownGraceSeconds = 30;
        private int interTargetDelayMinMs = 2000;
        private int interTargetDelayMaxMs = 10000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getStartupDelaySeconds() {
            return Math.max(0, startupDelaySeconds);
        }

        public void setStartupDelaySeconds(int startupDelaySeconds) {
            this.startupDelaySeconds = Math.max(0, startupDelaySeconds);
        }

        public int getShutdownGraceSeconds() {
            return Math.max(1, shutdownGraceSeconds);
        }

        public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
            this.shutdownGraceSeconds = Math.max(1, shutdownGraceSeconds);
        }

        public int getInterTargetDelayMinMs() {
            return Math.max(0, interTargetDelayMinMs);
        }

        public void setInterTargetDelayMinMs(int interTargetDelayMinMs) {
            this.interTargetDelayMinMs = Math.max(0, interTargetDelayMinMs);
        }

        public int getInterTargetDelayMaxMs() {
            return Math.max(getInterTargetDelayMinMs(), interTargetDelayMaxMs);
        }

        public void setInterTargetDelayMaxMs(int interTargetDelayMaxMs) {
            this.interTargetDelayMaxMs = Math.max(0, interTargetDelayMaxMs);
        }
    }

    public static class Fetch {
        private int requestTimeoutSeconds = 20;
        private int maxRetries = 2;
        private int retryBaseDelayMs = 1000;
        private int retryMaxDelayMs = 10000;
        private List<String> userAgents = new ArrayList<>(DEFAULT_USER_AGENTS);

        public int getRequestTimeoutSeconds() {
            return Math.max(1, requestTimeoutSeconds);
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
        }

        public int getMaxRetries() {
            return Math.max(0, maxRetries);
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = Math.max(0, maxRetries);
        }

        public int getRetryBaseDelayMs() {
            return Math.max(0, retryBaseDelayMs);
        }

        public void setRetryBaseDelayMs(int retryBaseDelayMs) {
            this.retryBaseDelayMs = Math.max(0, retryBaseDelayMs);
        }

        public int getRetryMaxDelayMs() {
            return Math.max(0, retryMaxDelayMs);
        }

        public void setRetryMaxDelayMs(int retryMaxDelayMs) {
            this.retryMaxDelayMs = Math.max(0, retryMaxDelayMs);
        }

        public List<String> getUserAgents() {
            if (userAgents == null || userAgents.stream().allMatch(agent -> agent == null || agent.isBlank())) {
                return DEFAULT_USER_AGENTS;
            }
            return userAgents.stream()
                .filter(agent -> agent != null && !agent.isBlank())
                .map(String::trim)
                .toList();
        }

        public void setUserAgents(List<String> userAgents) {
            this.userAgents = userAgents;
        }
    }

    public static class Extraction {
        private String itemBaseUrl = "https://facebook.com";
        private String itemPathPrefix = "/marketplace/item/";

        public String getItemBaseUrl() {
            if (itemBaseUrl == null || itemBaseUrl.isBlank()) {
                return "https://facebook.com";
            }
            String trimmed = itemBaseUrl.trim();
            return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
        }

        public void setItemBaseUrl(String itemBaseUrl) {
            this.itemBaseUrl = itemBaseUrl;
        }

        public String getItemPathPrefix() {
            return itemPathPrefix == null || itemPathPrefix.isBlank() ? "/marketplace/item/" : itemPathPrefix.trim();
        }

        public void setItemPathPrefix(String itemPathPrefix) {
            this.itemPathPrefix = itemPathPrefix;
        }
    }

    public static class Feed {
        private int windowDays = 7;
        private int maxItems = 100;
        private String title = "Marketplace Ad Feed";
        private String description = "An RSS feed to monitor new ads on the marketplace";

        public int getWindowDays() {
            return Math.max(1, windowDays);
        }

        public void setWindowDays(int windowDays) {
            this.windowDays = Math.max(1, windowDays);
        }

        public int getMaxItems() {
            return Math.max(1, maxItems);
        }

        public void setMaxItems(int maxItems) {
            this.maxItems = Math.max(1, maxItems);
        }

        public String getTitle() {
            return title;
        }

        public void setTitle(String title) {
            this.title = title;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }
}
