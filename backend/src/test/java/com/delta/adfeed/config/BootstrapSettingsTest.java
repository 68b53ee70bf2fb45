package com.delta.adfeed.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BootstrapSettingsTest {

    @TempDir
    Path tempDir;

    @Test
    void missingDocumentUsesDefaults() {
        Map<String, Object> properties = BootstrapSettings.fromConfigDocument(tempDir.resolve("absent.json"));

        assertThat(properties)
            .containsEntry("monitor.bootstrap.server-ip", "0.0.0.0")
            .containsEntry("monitor.bootstrap.server-port", 5000)
            .containsEntry("monitor.bootstrap.log-filename", "ad-feed-monitor.log")
            .containsEntry("monitor.bootstrap.datasource-url", "jdbc:h2:file:./ad-feed;DB_CLOSE_ON_EXIT=FALSE");
    }

    @Test
    void restartFieldsAreProjectedFromDocument() throws Exception {
        Path config = tempDir.resolve("config.json");
        Files.writeString(config, """
            {
              "server_ip": "127.0.0.1",
              "server_port": 8080,
              "log_filename": "monitor.log",
              "database_name": "ads.db"
            }
            """, StandardCharsets.UTF_8);

        Map<String, Object> properties = BootstrapSettings.fromConfigDocument(config);

        assertThat(properties)
            .containsEntry("monitor.config-file", config.toString())
            .containsEntry("monitor.bootstrap.server-ip", "127.0.0.1")
            .containsEntry("monitor.bootstrap.server-port", 8080)
            .containsEntry("monitor.bootstrap.log-filename", "monitor.log")
            .containsEntry("monitor.bootstrap.datasource-url", "jdbc:h2:file:./ads;DB_CLOSE_ON_EXIT=FALSE");
    }

    @Test
    void unreadableDocumentFallsBackToDefaults() throws Exception {
        Path config = tempDir.resolve("config.json");
        Files.writeString(config, "{ not json", StandardCharsets.UTF_8);

        Map<String, Object> properties = BootstrapSettings.fromConfigDocument(config);

        assertThat(properties).containsEntry("monitor.bootstrap.server-port", 5000);
    }

    @Test
    void h2UrlKeepsAbsolutePaths() {
        assertThat(BootstrapSettings.h2FileUrl("/var/lib/ads.mv.db"))
            .isEqualTo("jdbc:h2:file:/var/lib/ads;DB_CLOSE_ON_EXIT=FALSE");
    }
}
