package com.example.purgejobs.requests;

import com.example.purgejobs.models.DeliveryServiceRef;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Instant;

/**
 * HTTP payload of POST /api/jobs. {@code assetURL} is the path fragment below the delivery
 * service's primary origin.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateJobHttpRequest(
        @JsonProperty("deliveryService") @NotNull DeliveryServiceRef deliveryService,
        @JsonProperty("assetURL") @NotBlank String assetUrl,
        @JsonProperty("startTime") @NotNull Instant startTime,
        @JsonProperty("ttlHours") @NotNull @Positive Integer ttlHours
) {}
