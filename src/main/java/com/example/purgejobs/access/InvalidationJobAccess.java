package com.example.purgejobs.access;

import com.example.purgejobs.models.InvalidationJob;
import java.util.List;
import java.util.Optional;

/**
 * Read side of the job table. Writes go through {@link WriteTransaction} so that they commit
 * together with the fleet flags and the change log.
 */
public interface InvalidationJobAccess {
    String TABLE_NAME = "invalidation_jobs";

    Optional<InvalidationJob> findById(long id);

    /**
     * All jobs of one delivery service, via the jobs_by_delivery_service GSI.
     */
    List<InvalidationJob> findAllByDeliveryServiceId(long deliveryServiceId);

    List<InvalidationJob> find(JobQuery query);

    /**
     * The newest last_updated value among jobs matching {@code query}, without loading the
     * jobs themselves.
     */
    Optional<Long> findLatestUpdate(JobQuery query);
}
