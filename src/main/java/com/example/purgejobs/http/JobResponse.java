package com.example.purgejobs.http;

import com.example.purgejobs.models.InvalidationJob;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record JobResponse(
        @JsonProperty("id") long id,
        @JsonProperty("assetURL") String assetUrl,
        @JsonProperty("createdBy") String createdBy,
        @JsonProperty("deliveryService") String deliveryService,
        @JsonProperty("keyword") String keyword,
        @JsonProperty("parameters") String parameters,
        @JsonProperty("startTime") Instant startTime
) {
    static JobResponse from(InvalidationJob job) {
        return new JobResponse(
                job.getId(),
                job.getAssetUrl(),
                job.getCreatedByName(),
                job.getDeliveryServiceXmlId(),
                job.getKeyword(),
                job.parameters(),
                job.startInstant()
        );
    }
}
