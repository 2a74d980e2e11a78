package com.example.purgejobs.service;

import com.example.purgejobs.access.CdnLockAccess;
import com.example.purgejobs.models.DeliveryService;
import com.example.purgejobs.models.User;
import org.springframework.stereotype.Service;

@Service
public class CdnLockGuard {

    private final CdnLockAccess cdnLockAccess;

    public CdnLockGuard(CdnLockAccess cdnLockAccess) {
        this.cdnLockAccess = cdnLockAccess;
    }

    /**
     * @throws PurgeJobsException if another user holds a hard lock on the delivery service's CDN
     */
    public void ensureCanModify(User actingUser, DeliveryService deliveryService) {
        cdnLockAccess.findByCdnName(deliveryService.getCdnName())
                .filter(lock -> lock.blocks(actingUser.getUsername()))
                .ifPresent(lock -> {
                    throw PurgeJobsException.cdnLocked(lock.getCdnName(), lock.getUserName());
                });
    }
}
