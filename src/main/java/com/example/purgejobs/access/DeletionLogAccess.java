package com.example.purgejobs.access;

import java.util.Optional;

public interface DeletionLogAccess {
    /**
     * Epoch millis of the most recent deletion from {@code tableName}, if anything was ever
     * deleted from it.
     */
    Optional<Long> findLastDeleted(String tableName);
}
