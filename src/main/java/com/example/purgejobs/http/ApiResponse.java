package com.example.purgejobs.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Envelope for every API response: alerts for the user plus the payload, if any.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        @JsonProperty("alerts") List<Alert> alerts,
        @JsonProperty("response") T response
) {
    public ApiResponse {
        alerts = alerts == null ? null : List.copyOf(alerts);
    }

    public static <T> ApiResponse<T> of(T response) {
        return new ApiResponse<>(null, response);
    }

    public static ApiResponse<Void> error(String text) {
        return new ApiResponse<>(List.of(Alert.error(text)), null);
    }
}
