package com.dmarket.arb.infra;

import com.dmarket.arb.domain.ScanCheckpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * One JSON file per scan id. Writes go to a temp file in the same directory and are moved into
 * place atomically, so a crash mid-write leaves the previous checkpoint intact.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileCheckpointStore(Path directory, ObjectMapper objectMapper, Clock clock) {
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CheckpointException("Cannot create checkpoint directory " + directory, e);
        }
    }

    @Override
    public synchronized void save(ScanCheckpoint checkpoint) {
        Path target = fileFor(checkpoint.getScanId());
        Path temp = null;
        try {
            temp = Files.createTempFile(directory, ".checkpoint-", ".tmp");
            objectMapper.writeValue(temp.toFile(), checkpoint);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("[CHECKPOINT] Saved {} at cursor {}", checkpoint.getScanId(), checkpoint.getCursor());
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new CheckpointException("Failed to save checkpoint " + checkpoint.getScanId(), e);
        }
    }

    @Override
    public synchronized Optional<ScanCheckpoint> load(String scanId) {
        Path file = fileFor(scanId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), ScanCheckpoint.class));
        } catch (IOException e) {
            throw new CheckpointException("Failed to read checkpoint " + scanId, e);
        }
    }

    @Override
    public synchronized void delete(String scanId) {
        try {
            Files.deleteIfExists(fileFor(scanId));
        } catch (IOException e) {
            throw new CheckpointException("Failed to delete checkpoint " + scanId, e);
        }
    }

    @Override
    public synchronized int purgeOlderThan(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        int purged = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path file : files) {
                Instant updatedAt = readUpdatedAt(file);
                if (updatedAt != null && updatedAt.isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    purged++;
                }
            }
        } catch (IOException e) {
            throw new CheckpointException("Failed to purge checkpoints in " + directory, e);
        }
        return purged;
    }

    private Instant readUpdatedAt(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), ScanCheckpoint.class).getUpdatedAt();
        } catch (IOException e) {
            log.warn("[CHECKPOINT] Skipping unreadable checkpoint {}: {}", file.getFileName(), e.getMessage());
            return null;
        }
    }

    Path fileFor(String scanId) {
        return directory.resolve(scanId.replaceAll("[^A-Za-z0-9._-]", "_") + SUFFIX);
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.debug("[CHECKPOINT] Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
