package com.marketpulse.rag.repository;

import java.util.Optional;

public interface SnapshotRepository {

    /**
     * Replaces the stored snapshot.
     *
     * @throws com.marketpulse.rag.exception.PersistenceException on I/O failure
     */
    void save(IndexSnapshot snapshot);

    /**
     * @return the stored snapshot, or empty if none exists or it cannot be read back intact
     */
    Optional<IndexSnapshot> load();
}
