package com.example.purgejobs.access;

import com.example.purgejobs.models.Tenant;
import java.util.List;
import java.util.Optional;

public interface TenantAccess {
    Optional<Tenant> findById(long id);

    List<Tenant> findAll();
}
