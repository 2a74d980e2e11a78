package com.example.purgejobs.access;

import com.example.purgejobs.models.ChangeLogEntry;
import com.example.purgejobs.models.DeletionMarker;
import com.example.purgejobs.models.InvalidationJob;
import com.example.purgejobs.models.RevalidationFlag;

/**
 * Writes staged for one all-or-nothing commit. If any staged condition fails or the store
 * rejects the commit, none of the writes are applied and {@link #commit()} throws.
 */
public interface WriteTransaction {

    /** Inserts a job; fails the commit if the id is taken. */
    void createJob(InvalidationJob job);

    /** Replaces a job; fails the commit unless the stored job is still pending at {@code nowMillis}. */
    void updateJob(InvalidationJob job, long nowMillis);

    /** Removes a job; fails the commit if it is already gone. */
    void deleteJob(InvalidationJob job);

    void recordDeletion(DeletionMarker marker);

    /** Raises {@code flag} CDN-wide as of {@code raisedAt}; one write whatever the fleet size. */
    void raiseFlag(long cdnId, RevalidationFlag flag, long raisedAt);

    void appendChangeLog(ChangeLogEntry entry);

    void commit();
}
