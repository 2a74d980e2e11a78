package com.example.purgejobs.service;

import com.example.purgejobs.access.InvalidationJobAccess;
import com.example.purgejobs.models.InvalidationJob;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds existing jobs that purge overlapping content during an overlapping window. Results are
 * warnings only: redundant jobs are legitimate and nothing here locks against concurrent writes.
 *
 * <p>Two URLs overlap when either is a prefix of the other, compared case-sensitively and
 * without normalising trailing slashes. Windows are half-open, {@code [start, start + ttl)}.
 */
@Service
@Slf4j
public class ConflictValidator {

    private final InvalidationJobAccess jobAccess;

    public ConflictValidator(InvalidationJobAccess jobAccess) {
        this.jobAccess = jobAccess;
    }

    /**
     * @param excludedJobId the job being updated, skipped so it does not conflict with itself; null on create
     */
    public List<String> findConflicts(long deliveryServiceId,
                                      Instant startTime,
                                      int ttlHours,
                                      String assetUrl,
                                      Long excludedJobId) {
        Instant endTime = startTime.plus(Duration.ofHours(ttlHours));
        List<String> warnings = new ArrayList<>();

        List<InvalidationJob> candidates = jobAccess.findAllByDeliveryServiceId(deliveryServiceId).stream()
                .sorted(Comparator.comparing(InvalidationJob::getId))
                .toList();
        for (InvalidationJob existing : candidates) {
            if (existing.getId().equals(excludedJobId)) {
                continue;
            }
            if (!pathsOverlap(existing.getAssetUrl(), assetUrl)) {
                continue;
            }
            Instant overlapStart = max(startTime, existing.startInstant());
            Instant overlapEnd = min(endTime, existing.endInstant());
            if (overlapStart.isBefore(overlapEnd)) {
                warnings.add(String.format(
                        "Invalidation job %d for '%s' already covers this content from %s to %s",
                        existing.getId(), existing.getAssetUrl(), overlapStart, overlapEnd));
            }
        }

        if (!warnings.isEmpty()) {
            log.warn("Job for '{}' on delivery service {} overlaps {} existing job(s)",
                    assetUrl, deliveryServiceId, warnings.size());
        }
        return warnings;
    }

    static boolean pathsOverlap(String a, String b) {
        return a.startsWith(b) || b.startsWith(a);
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
