package com.example.purgejobs.service;

import com.example.purgejobs.access.CdnRevalidationAccess;
import com.example.purgejobs.access.DeliveryServiceAccess;
import com.example.purgejobs.access.ServerAccess;
import com.example.purgejobs.access.WriteTransaction;
import com.example.purgejobs.models.CdnRevalidation;
import com.example.purgejobs.models.DeliveryService;
import com.example.purgejobs.models.DeliveryServiceRef;
import com.example.purgejobs.models.RevalidationFlag;
import com.example.purgejobs.models.Server;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Marks the fleet members that must pick up a job change. The mark is staged on the caller's
 * transaction so it commits together with the job itself, and it is raised once for the CDN
 * rather than once per server.
 */
@Service
@Slf4j
public class RevalidationFlagPropagator {

    private final DeliveryServiceAccess deliveryServiceAccess;
    private final ServerAccess serverAccess;
    private final CdnRevalidationAccess cdnRevalidationAccess;
    private final GlobalParameters globalParameters;
    private final Clock clock;

    public RevalidationFlagPropagator(DeliveryServiceAccess deliveryServiceAccess,
                                      ServerAccess serverAccess,
                                      CdnRevalidationAccess cdnRevalidationAccess,
                                      GlobalParameters globalParameters,
                                      Clock clock) {
        this.deliveryServiceAccess = deliveryServiceAccess;
        this.serverAccess = serverAccess;
        this.cdnRevalidationAccess = cdnRevalidationAccess;
        this.globalParameters = globalParameters;
        this.clock = clock;
    }

    /**
     * Raises the configured flag for the delivery service's CDN. It reaches every in-service
     * server of that CDN whose profile reads the revalidation config; nothing is staged when
     * no server qualifies.
     *
     * @return number of servers the flag reaches
     */
    public int propagate(WriteTransaction transaction, DeliveryServiceRef scope) {
        RevalidationFlag flag = globalParameters.revalidationFlag();

        Optional<DeliveryService> deliveryService = deliveryServiceAccess.findByRef(scope);
        if (deliveryService.isEmpty()) {
            log.warn("Delivery service {} not found; no servers marked", scope);
            return 0;
        }

        long cdnId = deliveryService.get().getCdnId();
        Set<String> profiles = globalParameters.revalidatingProfiles();
        int targets = (int) serverAccess.findAllByCdnId(cdnId).stream()
                .filter(server -> reads(server, profiles))
                .count();
        if (targets == 0) {
            log.info("No server on CDN {} reads the revalidation config; nothing marked",
                    deliveryService.get().getCdnName());
            return 0;
        }

        transaction.raiseFlag(cdnId, flag, clock.millis());
        log.info("Marking {} server(s) on CDN {} with {}",
                targets, deliveryService.get().getCdnName(), flag.attributeName());
        return targets;
    }

    /**
     * Flags the server still has to act on, combining its own flags with its CDN's marker.
     */
    public Set<RevalidationFlag> pendingFlags(Server server) {
        Objects.requireNonNull(server, "server");
        CdnRevalidation marker = server.getCdnId() == null
                ? null
                : cdnRevalidationAccess.findByCdnId(server.getCdnId()).orElse(null);
        return server.pendingFlags(marker, globalParameters.revalidatingProfiles());
    }

    private static boolean reads(Server server, Set<String> profiles) {
        return server.inService() && server.getProfile() != null && profiles.contains(server.getProfile());
    }
}
