package com.example.purgejobs.access;

import com.example.purgejobs.models.CdnRevalidation;
import java.util.Optional;

public interface CdnRevalidationAccess {
    Optional<CdnRevalidation> findByCdnId(long cdnId);
}
