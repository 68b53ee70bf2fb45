package com.delta.adfeed.monitor.service;

import com.delta.adfeed.monitor.filter.FilterEngine;
import com.delta.adfeed.monitor.model.ChangeEffect;
import com.delta.adfeed.monitor.model.ConfigFieldChange;
import com.delta.adfeed.monitor.model.ConfigSnapshot;
import com.delta.adfeed.monitor.model.ConfigUpdateResult;
import com.delta.adfeed.monitor.model.ConfigUpdateStatus;
import com.delta.adfeed.monitor.persistence.ConfigDocumentStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MonitorConfigServiceTest {
    private static final String INITIAL = """
        {
          "server_ip": "0.0.0.0",
          "server_port": 5000,
          "currency": "$",
          "refresh_interval_minutes": 15,
          "log_filename": "monitor.log",
          "database_name": "ads.db",
          "url_filters": {
            "https://facebook.com/marketplace/nyc/search?query=sofa": {"level1": ["sofa"]}
          }
        }
        """;

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private Path file;
    private ConfigDocumentStore store;
    private MonitorConfigService service;

    @BeforeEach
    void setUp() throws Exception {
        file = tempDir.resolve("config.json");
        Files.writeString(file, INITIAL, StandardCharsets.UTF_8);
        store = new ConfigDocumentStore(file, mapper);
        service = new MonitorConfigService(store, new ConfigValidator(new FilterEngine()));
        service.load();
    }

    @Test
    void loadsSnapshotFromDocument() {
        ConfigSnapshot snapshot = service.getSnapshot();

        assertThat(snapshot.refreshIntervalMinutes()).isEqualTo(15);
        assertThat(snapshot.targets()).hasSize(1);
    }

    @Test
    void missingDocumentFallsBackToDefaults() {
        MonitorConfigService fresh = new MonitorConfigService(
            new ConfigDocumentStore(tempDir.resolve("missing.json"), mapper),
            new ConfigValidator(new FilterEngine())
        );
        fresh.load();

        assertThat(fresh.getSnapshot()).isEqualTo(ConfigSnapshot.defaults());
    }

    @Test
    void invalidDocumentAbortsStartup() throws Exception {
        Files.writeString(file, "{\"server_port\": -1}", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> service.load()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectedUpdateLeavesDocumentUntouched() throws Exception {
        String before = store.currentHash();

        ConfigUpdateResult result = service.applyUpdate(mapper.readTree(
            "{\"server_ip\": \"0.0.0.0\", \"server_port\": 5000, \"refresh_interval_minutes\": -3}"
        ));

        assertThat(result.accepted()).isFalse();
        assertThat(result.status()).isEqualTo(ConfigUpdateStatus.REJECTED);
        assertThat(store.currentHash()).isEqualTo(before);
        assertThat(service.getSnapshot().refreshIntervalMinutes()).isEqualTo(15);
    }

    @Test
    void appliedUpdateClassifiesEachChangedField() throws Exception {
        List<ConfigSnapshot> notified = new ArrayList<>();
        service.addListener((previous, current) -> notified.add(current));

        JsonNode candidate = mapper.readTree(INITIAL.replace("\"refresh_interval_minutes\": 15", "\"refresh_interval_minutes\": 5")
            .replace("\"server_port\": 5000", "\"server_port\": 6000"));
        ConfigUpdateResult result = service.applyUpdate(candidate);

        assertThat(result.status()).isEqualTo(ConfigUpdateStatus.APPLIED);
        assertThat(result.changes()).containsExactlyInAnyOrder(
            new ConfigFieldChange("server_port", ChangeEffect.REQUIRES_RESTART),
            new ConfigFieldChange("refresh_interval_minutes", ChangeEffect.APPLIED_LIVE)
        );
        assertThat(result.requiresRestart()).isTrue();
        assertThat(service.getSnapshot().refreshIntervalMinutes()).isEqualTo(5);
        assertThat(store.readTree().path("server_port").asInt()).isEqualTo(6000);
        assertThat(notified).hasSize(1);
    }

    @Test
    void filterChangeAppliesLive() throws Exception {
        JsonNode candidate = mapper.readTree(INITIAL.replace("[\"sofa\"]", "[\"sofa\", \"couch\"]"));

        ConfigUpdateResult result = service.applyUpdate(candidate);

        assertThat(result.changes()).containsExactly(new ConfigFieldChange("url_filters", ChangeEffect.APPLIED_LIVE));
        assertThat(result.requiresRestart()).isFalse();
    }

    @Test
    void failedApplicationRestoresDocumentAndSnapshot() throws Exception {
        String before = store.currentHash();
        ConfigSnapshot previous = service.getSnapshot();
        List<Integer> seenIntervals = new ArrayList<>();
        service.addListener((old, current) -> {
            seenIntervals.add(current.refreshIntervalMinutes());
            if (current.refreshIntervalMinutes() == 1) {
                throw new IllegalStateException("cannot reschedule");
            }
        });

        ConfigUpdateResult result = service.applyUpdate(mapper.readTree(
            INITIAL.replace("\"refresh_interval_minutes\": 15", "\"refresh_interval_minutes\": 1")
        ));

        assertThat(result.accepted()).isFalse();
        assertThat(result.status()).isEqualTo(ConfigUpdateStatus.ROLLED_BACK);
        assertThat(store.currentHash()).isEqualTo(before);
        assertThat(service.getSnapshot()).isEqualTo(previous);
        assertThat(seenIntervals).containsExactly(1, 15);
    }

    @Test
    void tamperedBackupReportsRollbackFailure() throws Exception {
        ConfigSnapshot previous = service.getSnapshot();
        Path backupFile = tempDir.resolve("config.json.bak");
        service.addListener((old, current) -> {
            if (current.refreshIntervalMinutes() == 1) {
                try {
                    Files.writeString(backupFile, "{}", StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                throw new IllegalStateException("cannot reschedule");
            }
        });

        ConfigUpdateResult result = service.applyUpdate(mapper.readTree(
            INITIAL.replace("\"refresh_interval_minutes\": 15", "\"refresh_interval_minutes\": 1")
        ));

        assertThat(result.status()).isEqualTo(ConfigUpdateStatus.ROLLBACK_FAILED);
        assertThat(result.accepted()).isFalse();
        assertThat(service.getSnapshot()).isEqualTo(previous);
    }

    @Test
    void unchangedDocumentIsNotRewritten() throws Exception {
        String before = store.currentHash();

        ConfigUpdateResult result = service.applyUpdate(mapper.readTree(INITIAL));

        assertThat(result.status()).isEqualTo(ConfigUpdateStatus.APPLIED);
        assertThat(result.changes()).isEmpty();
        assertThat(store.currentHash()).isEqualTo(before);
    }
}
