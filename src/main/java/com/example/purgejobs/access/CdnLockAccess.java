package com.example.purgejobs.access;

import com.example.purgejobs.models.CdnLock;
import java.util.Optional;

public interface CdnLockAccess {
    Optional<CdnLock> findByCdnName(String cdnName);
}
