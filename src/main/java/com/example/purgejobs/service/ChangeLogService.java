package com.example.purgejobs.service;

import com.example.purgejobs.access.WriteTransaction;
import com.example.purgejobs.models.ChangeLogEntry;
import com.example.purgejobs.models.InvalidationJob;
import com.example.purgejobs.models.User;
import java.time.Clock;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Formats change-log entries for job mutations and stages them on the mutation's transaction.
 */
@Service
@RequiredArgsConstructor
public class ChangeLogService {

    private final Clock clock;

    public void recordCreated(WriteTransaction transaction, User actor, InvalidationJob job, boolean duplicate) {
        append(transaction, actor, "Created content invalidation job " + (duplicate ? "(duplicate) " : "")
                + "- " + describe(job));
    }

    public void recordUpdated(WriteTransaction transaction, User actor, InvalidationJob job) {
        append(transaction, actor, "Updated content invalidation job - " + describe(job));
    }

    public void recordDeleted(WriteTransaction transaction, User actor, InvalidationJob job) {
        append(transaction, actor, "Deleted content invalidation job - " + describe(job));
    }

    private void append(WriteTransaction transaction, User actor, String message) {
        long now = clock.millis();
        transaction.appendChangeLog(ChangeLogEntry.builder()
                .userName(actor.getUsername())
                .tsUlid(generateTimestampUlid(now))
                .level(ChangeLogEntry.API_CHANGE)
                .message(message)
                .timestamp(now)
                .build());
    }

    private static String describe(InvalidationJob job) {
        return "ID: " + job.getId()
                + " DS: " + job.getDeliveryServiceXmlId()
                + " URL: '" + job.getAssetUrl() + "'"
                + " Params: '" + job.parameters() + "'";
    }

    /**
     * Millisecond timestamp plus a random suffix, so entries sort chronologically per user.
     */
    private String generateTimestampUlid(long timestamp) {
        String random = UUID.randomUUID().toString().replace("-", "").toUpperCase();
        return timestamp + "_" + random;
    }
}
