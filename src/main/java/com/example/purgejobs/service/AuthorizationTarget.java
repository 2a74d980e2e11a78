package com.example.purgejobs.service;

import com.example.purgejobs.access.DeliveryServiceAccess;
import com.example.purgejobs.access.UserAccess;
import com.example.purgejobs.models.DeliveryService;
import com.example.purgejobs.models.DeliveryServiceRef;
import com.example.purgejobs.models.User;
import java.util.Optional;

/**
 * A resource whose owning tenant decides whether a user may act on it.
 */
public sealed interface AuthorizationTarget {

    /**
     * Looks up the tenant that owns the target, or empty if the target does not exist.
     */
    Optional<Long> owningTenantId(DeliveryServiceAccess deliveryServices, UserAccess users);

    static AuthorizationTarget deliveryService(DeliveryServiceRef ref) {
        return ref.map(DeliveryServiceById::new, DeliveryServiceByXmlId::new);
    }

    record DeliveryServiceById(long id) implements AuthorizationTarget {
        @Override
        public Optional<Long> owningTenantId(DeliveryServiceAccess deliveryServices, UserAccess users) {
            return deliveryServices.findById(id).map(DeliveryService::getTenantId);
        }
    }

    record DeliveryServiceByXmlId(String xmlId) implements AuthorizationTarget {
        @Override
        public Optional<Long> owningTenantId(DeliveryServiceAccess deliveryServices, UserAccess users) {
            return deliveryServices.findByXmlId(xmlId).map(DeliveryService::getTenantId);
        }
    }

    record UserById(long id) implements AuthorizationTarget {
        @Override
        public Optional<Long> owningTenantId(DeliveryServiceAccess deliveryServices, UserAccess users) {
            return users.findById(id).map(User::getTenantId);
        }
    }

    record UserByName(String username) implements AuthorizationTarget {
        @Override
        public Optional<Long> owningTenantId(DeliveryServiceAccess deliveryServices, UserAccess users) {
            return users.findByUsername(username).map(User::getTenantId);
        }
    }
}
