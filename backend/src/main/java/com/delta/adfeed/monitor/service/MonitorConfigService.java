package com.delta.adfeed.monitor.service;

import com.delta.adfeed.monitor.model.ChangeEffect;
import com.delta.adfeed.monitor.model.ConfigDocument;
import com.delta.adfeed.monitor.model.ConfigFieldChange;
import com.delta.adfeed.monitor.model.ConfigSnapshot;
import com.delta.adfeed.monitor.model.ConfigUpdateResult;
import com.delta.adfeed.monitor.persistence.ConfigDocumentStore;
import com.delta.adfeed.monitor.persistence.ConfigPersistenceException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Owns the live {@link ConfigSnapshot}. Updates are validated, written through
 * {@link ConfigDocumentStore} after a backup, and only then swapped in. Any failure after the write
 * restores both the document and the previous snapshot.
 */
@Service
public class MonitorConfigService {
    private static final Logger log = LoggerFactory.getLogger(MonitorConfigService.class);

    private final ConfigDocumentStore store;
    private final ConfigValidator validator;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ConfigSnapshot snapshot = ConfigSnapshot.defaults();

    public MonitorConfigService(ConfigDocumentStore store, ConfigValidator validator) {
        this.store = store;
        this.validator = validator;
    }

    @PostConstruct
    public void load() {
        lock.writeLock().lock();
        try {
            if (!store.exists()) {
                log.info("Config document {} not found; using defaults", store.file());
                snapshot = ConfigSnapshot.defaults();
                return;
            }
            try {
                snapshot = validator.validate(store.readTree());
            } catch (ConfigValidationException | ConfigPersistenceException e) {
                throw new IllegalStateException("Unable to load config document " + store.file(), e);
            }
            log.info(
                "Loaded config document {} with {} targets, refresh every {} min",
                store.file(),
                snapshot.targets().size(),
                snapshot.refreshIntervalMinutes()
            );
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ConfigSnapshot getSnapshot() {
        lock.readLock().lock();
        try {
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    public ConfigDocument getDocument() {
        return ConfigDocument.fromSnapshot(getSnapshot());
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    public ConfigUpdateResult applyUpdate(JsonNode candidate) {
        lock.writeLock().lock();
        try {
            ConfigSnapshot next;
            try {
                next = validator.validate(candidate);
            } catch (ConfigValidationException e) {
                log.warn("Rejected config update: {}", e.getViolations());
                return ConfigUpdateResult.rejected(e.getMessage());
            }

            ConfigSnapshot previous = snapshot;
            List<ConfigFieldChange> changes = classifyChanges(previous, next);
            if (changes.isEmpty()) {
                return ConfigUpdateResult.applied("No changes", changes);
            }

            ConfigDocumentStore.Backup backup;
            try {
                backup = store.backup();
            } catch (ConfigPersistenceException e) {
                log.warn("Config update aborted before writing: {}", e.getMessage());
                return ConfigUpdateResult.rolledBack("Unable to back up current config; nothing changed", changes);
            }

            try {
                store.write(ConfigDocument.fromSnapshot(next));
                snapshot = next;
                notifyListeners(previous, next);
            } catch (RuntimeException e) {
                log.warn("Config update failed during application; rolling back", e);
                return rollBack(backup, previous, next, changes, e);
            }

            log.info("Applied config update: {}", changes);
            boolean restartNeeded = changes.stream().anyMatch(change -> change.effect() == ChangeEffect.REQUIRES_RESTART);
            return ConfigUpdateResult.applied(
                restartNeeded ? "Configuration saved; some changes take effect after a restart" : "Configuration applied",
                changes
            );
        } finally {
            lock.writeLock().unlock();
        }
    }

    private ConfigUpdateResult rollBack(
        ConfigDocumentStore.Backup backup,
        ConfigSnapshot previous,
        ConfigSnapshot failed,
        List<ConfigFieldChange> changes,
        RuntimeException cause
    ) {
        snapshot = previous;
        try {
            store.restore(backup);
            notifyListeners(failed, previous);
        } catch (RuntimeException e) {
            log.error("Config rollback failed; persisted and live configuration may differ", e);
            return ConfigUpdateResult.rollbackFailed(
                "Update failed (" + cause.getMessage() + ") and rollback failed (" + e.getMessage() + ")",
                changes
            );
        }
        return ConfigUpdateResult.rolledBack(
            "Update failed (" + cause.getMessage() + "); previous configuration restored",
            changes
        );
    }

    private void notifyListeners(ConfigSnapshot previous, ConfigSnapshot current) {
        for (ConfigChangeListener listener : listeners) {
            listener.onConfigApplied(previous, current);
        }
    }

    static List<ConfigFieldChange> classifyChanges(ConfigSnapshot previous, ConfigSnapshot next) {
        List<ConfigFieldChange> changes = new ArrayList<>();
        addIfChanged(changes, "server_ip", ChangeEffect.REQUIRES_RESTART, previous, next, ConfigSnapshot::serverIp);
        addIfChanged(changes, "server_port", ChangeEffect.REQUIRES_RESTART, previous, next, ConfigSnapshot::serverPort);
        addIfChanged(changes, "currency", ChangeEffect.APPLIED_LIVE, previous, next, ConfigSnapshot::currency);
        addIfChanged(
            changes,
            "refresh_interval_minutes",
            ChangeEffect.APPLIED_LIVE,
            previous,
            next,
            ConfigSnapshot::refreshIntervalMinutes
        );
        addIfChanged(changes, "log_filename", ChangeEffect.REQUIRES_RESTART, previous, next, ConfigSnapshot::logFilename);
        addIfChanged(changes, "database_name", ChangeEffect.REQUIRES_RESTART, previous, next, ConfigSnapshot::databaseName);
        addIfChanged(changes, "url_filters", ChangeEffect.APPLIED_LIVE, previous, next, ConfigSnapshot::targets);
        return changes;
    }

    private static void addIfChanged(
        List<ConfigFieldChange> changes,
        String field,
        ChangeEffect effect,
        ConfigSnapshot previous,
        ConfigSnapshot next,
        Function<ConfigSnapshot, ?> accessor
    ) {
        if (!Objects.equals(accessor.apply(previous), accessor.apply(next))) {
            changes.add(new ConfigFieldChange(field, effect));
        }
    }
}
