package com.dmarket.arb.infra;

import com.dmarket.arb.domain.ScanCheckpoint;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable scan progress keyed by scan id. {@code save} is last-write-wins. Implementations throw
 * {@link CheckpointException} when the backing store fails.
 */
public interface CheckpointStore {

    void save(ScanCheckpoint checkpoint);

    Optional<ScanCheckpoint> load(String scanId);

    void delete(String scanId);

    /** Removes checkpoints not updated within {@code retention}; returns how many were removed. */
    int purgeOlderThan(Duration retention);
}
