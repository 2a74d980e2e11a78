package com.example.purgejobs.requests;

import com.example.purgejobs.models.DeliveryServiceRef;
import java.time.Instant;
import java.util.Objects;

/**
 * @param jobId      the job addressed by the request URL
 * @param payloadId  the id carried in the body; must equal {@code jobId}
 */
public record ReplaceJobServiceRequest(
        long jobId,
        long payloadId,
        DeliveryServiceRef deliveryService,
        String createdBy,
        String assetUrl,
        Instant startTime,
        int ttlHours
) {
    public ReplaceJobServiceRequest {
        Objects.requireNonNull(deliveryService, "deliveryService");
        Objects.requireNonNull(createdBy, "createdBy");
        if (createdBy.isBlank()) {
            throw new IllegalArgumentException("createdBy must be non-blank");
        }
        Objects.requireNonNull(assetUrl, "assetUrl");
        Objects.requireNonNull(startTime, "startTime");
    }
}
