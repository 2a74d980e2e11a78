package com.example.purgejobs.access;

public interface JobSequenceAccess {
    /**
     * Draws the next job id. Ids increase monotonically; gaps are possible when a transaction
     * that drew an id is rolled back.
     */
    long nextJobId();
}
