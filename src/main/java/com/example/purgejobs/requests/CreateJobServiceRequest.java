package com.example.purgejobs.requests;

import com.example.purgejobs.models.DeliveryServiceRef;
import java.time.Instant;
import java.util.Objects;

public record CreateJobServiceRequest(
        DeliveryServiceRef deliveryService,
        String assetPath,
        Instant startTime,
        int ttlHours
) {
    public CreateJobServiceRequest {
        Objects.requireNonNull(deliveryService, "deliveryService");
        Objects.requireNonNull(assetPath, "assetPath");
        Objects.requireNonNull(startTime, "startTime");
    }
}
