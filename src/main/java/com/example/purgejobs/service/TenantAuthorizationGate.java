package com.example.purgejobs.service;

import com.example.purgejobs.access.DeliveryServiceAccess;
import com.example.purgejobs.access.TenantAccess;
import com.example.purgejobs.access.UserAccess;
import com.example.purgejobs.models.Tenant;
import com.example.purgejobs.models.User;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Decides whether a user's tenant may act on a resource: it must be the resource's tenant or
 * one of its ancestors. A missing resource is reported as "not authorized" so that callers
 * cannot tell absent resources from hidden ones. The tenant tree is read per call.
 */
@Service
@Slf4j
public class TenantAuthorizationGate {

    private final TenantAccess tenantAccess;
    private final DeliveryServiceAccess deliveryServiceAccess;
    private final UserAccess userAccess;

    public TenantAuthorizationGate(TenantAccess tenantAccess,
                                   DeliveryServiceAccess deliveryServiceAccess,
                                   UserAccess userAccess) {
        this.tenantAccess = tenantAccess;
        this.deliveryServiceAccess = deliveryServiceAccess;
        this.userAccess = userAccess;
    }

    public boolean authorize(User actingUser, AuthorizationTarget target) {
        Objects.requireNonNull(actingUser, "actingUser");
        Objects.requireNonNull(target, "target");

        Optional<Long> resourceTenantId = target.owningTenantId(deliveryServiceAccess, userAccess);
        if (resourceTenantId.isEmpty()) {
            log.debug("Authorization target {} not found", target);
            return false;
        }

        Optional<Tenant> actingTenant = tenantAccess.findById(actingUser.getTenantId());
        if (actingTenant.isEmpty() || !Boolean.TRUE.equals(actingTenant.get().getActive())) {
            return false;
        }

        return isAncestorOrSelf(actingUser.getTenantId(), resourceTenantId.get());
    }

    /**
     * The acting user's tenant and all of its descendants. Empty when the tenant is missing or
     * inactive.
     */
    public Set<Long> accessibleTenantIds(User actingUser) {
        List<Tenant> tenants = tenantAccess.findAll();
        Long root = actingUser.getTenantId();
        boolean active = tenants.stream()
                .anyMatch(t -> t.getId().equals(root) && Boolean.TRUE.equals(t.getActive()));
        if (!active) {
            return Set.of();
        }

        Map<Long, List<Long>> children = new HashMap<>();
        for (Tenant tenant : tenants) {
            if (tenant.getParentId() != null) {
                children.computeIfAbsent(tenant.getParentId(), k -> new ArrayList<>()).add(tenant.getId());
            }
        }

        Set<Long> accessible = new HashSet<>();
        Deque<Long> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Long current = pending.pop();
            if (accessible.add(current)) {
                children.getOrDefault(current, List.of()).forEach(pending::push);
            }
        }
        return accessible;
    }

    private boolean isAncestorOrSelf(long ancestorId, long tenantId) {
        Set<Long> visited = new HashSet<>();
        Long current = tenantId;
        while (current != null) {
            if (current == ancestorId) {
                return true;
            }
            if (!visited.add(current)) {
                log.warn("Tenant hierarchy contains a cycle at tenant {}", current);
                return false;
            }
            current = tenantAccess.findById(current).map(Tenant::getParentId).orElse(null);
        }
        return false;
    }
}
