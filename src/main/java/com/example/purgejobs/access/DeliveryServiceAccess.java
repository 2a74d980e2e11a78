package com.example.purgejobs.access;

import com.example.purgejobs.models.DeliveryService;
import com.example.purgejobs.models.DeliveryServiceRef;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface DeliveryServiceAccess {
    Optional<DeliveryService> findById(long id);

    Optional<DeliveryService> findByXmlId(String xmlId);

    default Optional<DeliveryService> findByRef(DeliveryServiceRef ref) {
        return ref.map(this::findById, this::findByXmlId);
    }

    /**
     * Lists every delivery service owned by one of {@code tenantIds}. Used to turn tenant
     * visibility into a set of delivery service ids for job listings.
     */
    List<DeliveryService> findAllByTenantIds(Set<Long> tenantIds);
}
