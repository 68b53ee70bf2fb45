package com.delta.adfeed.monitor.persistence;

import com.delta.adfeed.config.MonitorProperties;
import com.delta.adfeed.monitor.model.ConfigDocument;
import com.delta.adfeed.monitor.util.HashUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;

/**
 * File-backed config document. Writes are staged to a sibling temp file, flushed to disk, verified
 * and then moved over the live file, so readers only ever see a complete document. The previous
 * version stays in a {@code .bak} sibling until the next update.
 */
@Component
public class ConfigDocumentStore {
    private static final Logger log = LoggerFactory.getLogger(ConfigDocumentStore.class);

    private final Path file;
    private final Path backupFile;
    private final Path stagingFile;
    private final ObjectMapper objectMapper;

    @Autowired
    public ConfigDocumentStore(MonitorProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getConfigFile()), objectMapper);
    }

    public ConfigDocumentStore(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath();
        this.backupFile = this.file.resolveSibling(this.file.getFileName() + ".bak");
        this.stagingFile = this.file.resolveSibling(this.file.getFileName() + ".tmp");
        this.objectMapper = objectMapper;
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.isRegularFile(file);
    }

    public JsonNode readTree() {
        try {
            return objectMapper.readTree(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new ConfigPersistenceException("Unable to read config document " + file, e);
        }
    }

    public String currentHash() {
        if (!exists()) {
            return null;
        }
        try {
            return HashUtils.sha256Hex(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new ConfigPersistenceException("Unable to hash config document " + file, e);
        }
    }

    public Backup backup() {
        if (!exists()) {
            return new Backup(false, null);
        }
        try {
            byte[] current = Files.readAllBytes(file);
            writeDurably(backupFile, current);
            return new Backup(true, HashUtils.sha256Hex(current));
        } catch (IOException e) {
            throw new ConfigPersistenceException("Unable to back up config document " + file, e);
        }
    }

    public void write(ConfigDocument document) {
        byte[] payload;
        try {
            payload = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(document);
        } catch (IOException e) {
            throw new ConfigPersistenceException("Unable to serialize config document", e);
        }
        replaceWith(payload);
    }

    public void restore(Backup backup) {
        if (backup == null || !backup.existed()) {
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new ConfigPersistenceException("Unable to remove config document " + file, e);
            }
            return;
        }
        byte[] saved;
        try {
            saved = Files.readAllBytes(backupFile);
        } catch (IOException e) {
            throw new ConfigPersistenceException("Unable to read config backup " + backupFile, e);
        }
        if (!HashUtils.sha256Hex(saved).equals(backup.sha256())) {
            throw new ConfigPersistenceException("Config backup " + backupFile + " changed since it was taken");
        }
        replaceWith(saved);
    }

    private void replaceWith(byte[] payload) {
        try {
            writeDurably(stagingFile, payload);
            byte[] staged = Files.readAllBytes(stagingFile);
            if (!Arrays.equals(staged, payload)) {
                throw new ConfigPersistenceException("Staged config document does not match what was written");
            }
            moveIntoPlace();
            byte[] live = Files.readAllBytes(file);
            if (!Arrays.equals(live, payload)) {
                throw new ConfigPersistenceException("Config document " + file + " does not match what was written");
            }
        } catch (IOException e) {
            throw new ConfigPersistenceException("Unable to write config document " + file, e);
        } finally {
            try {
                Files.deleteIfExists(stagingFile);
            } catch (IOException e) {
                log.warn("Unable to remove staging file {}", stagingFile, e);
            }
        }
    }

    private void moveIntoPlace() throws IOException {
        try {
            Files.move(stagingFile, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}; falling back to plain replace", file);
            Files.move(stagingFile, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void writeDurably(Path target, byte[] payload) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (FileChannel channel = FileChannel.open(
            target,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        )) {
            ByteBuffer buffer = ByteBuffer.wrap(payload);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    public record Backup(boolean existed, String sha256) {
    }
}
