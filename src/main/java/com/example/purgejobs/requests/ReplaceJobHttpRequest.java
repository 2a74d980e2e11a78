package com.example.purgejobs.requests;

import com.example.purgejobs.models.DeliveryServiceRef;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * HTTP payload of PUT /api/jobs?id=N. It carries the job's full representation; the identity
 * fields must match the stored job and the value ranges are checked by the service, after the
 * job has been found and authorized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReplaceJobHttpRequest(
        @JsonProperty("id") @NotNull Long id,
        @JsonProperty("deliveryService") @NotNull DeliveryServiceRef deliveryService,
        @JsonProperty("createdBy") @NotBlank String createdBy,
        @JsonProperty("assetURL") @NotBlank String assetUrl,
        @JsonProperty("startTime") @NotNull Instant startTime,
        @JsonProperty("ttlHours") @NotNull Integer ttlHours
) {}
